package com.companionagent.notification.sender;

import com.companionagent.common.model.CritiqueReviewNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

@Component
public class SlackWebhookSender {

    private static final Logger log = LoggerFactory.getLogger(SlackWebhookSender.class);

    private final WebClient webClient;

    @Value("${notification.slack.webhook-url:}")
    private String slackWebhookUrl = "";

    @Value("${notification.slack.enabled:false}")
    private boolean slackEnabled;

    public SlackWebhookSender(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    /** @return {@code true} when a webhook POST was dispatched, {@code false} when only logged */
    public boolean sendCritique(CritiqueReviewNotification notification) {
        if (!slackEnabled || slackWebhookUrl == null || slackWebhookUrl.isBlank()) {
            log.info("[Notify] Slack disabled. Logging review. turnId={} sessionId={} approved={} issues={} severity={}",
                     notification.turnId(), notification.sessionId(), notification.approved(),
                     notification.issueCount(), notification.severity());
            return false;
        }

        String message = CritiqueMessageFormatter.format(notification);

        webClient.post()
            .uri(slackWebhookUrl)
            .bodyValue(Map.of("text", message))
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("[Notify] Slack review notification sent. turnId={} status={}",
                                notification.turnId(), r.getStatusCode()),
                err -> log.error("[Notify] Slack review notification failed. turnId={}",
                                 notification.turnId(), err)
            );
        return true;
    }
}
