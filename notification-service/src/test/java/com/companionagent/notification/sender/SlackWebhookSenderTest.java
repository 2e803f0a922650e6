package com.companionagent.notification.sender;

import com.companionagent.common.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.companionagent.notification.sender.CritiqueMessageFormatterTest.notification;
import static org.junit.jupiter.api.Assertions.*;

class SlackWebhookSenderTest {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    private SlackWebhookSender sender(boolean enabled, String url) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(HttpStatus.OK).build());
        });
        SlackWebhookSender sender = new SlackWebhookSender(builder);
        ReflectionTestUtils.setField(sender, "slackEnabled", enabled);
        ReflectionTestUtils.setField(sender, "slackWebhookUrl", url);
        return sender;
    }

    @Test
    @DisplayName("disabled sender only logs")
    void disabled() {
        assertFalse(sender(false, "http://slack.test/hook").sendCritique(notification(true, 0, Severity.MINOR)));
        assertTrue(requests.isEmpty());
    }

    @Test
    @DisplayName("enabled sender without a webhook URL only logs")
    void noUrl() {
        assertFalse(sender(true, "  ").sendCritique(notification(false, 2, Severity.MODERATE)));
        assertTrue(requests.isEmpty());
    }

    @Test
    @DisplayName("enabled sender POSTs to the webhook")
    void posts() {
        assertTrue(sender(true, "http://slack.test/hook").sendCritique(notification(false, 2, Severity.MODERATE)));

        assertEquals(1, requests.size());
        ClientRequest sent = requests.get(0);
        assertEquals(HttpMethod.POST, sent.method());
        assertEquals("/hook", sent.url().getPath());
    }
}
