package com.companionagent.notification.controller;

import com.companionagent.common.model.CritiqueReviewNotification;
import com.companionagent.common.model.Severity;
import com.companionagent.notification.sender.SlackWebhookSender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class NotificationControllerTest {

    private SlackWebhookSender sender;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        sender = mock(SlackWebhookSender.class);
        client = WebTestClient.bindToController(new NotificationController(sender)).build();
    }

    @Test
    @DisplayName("critique review is accepted and forwarded")
    void forwardsCritique() {
        String body = """
            {"userId": "user-1", "sessionId": "session-1", "turnId": "turn-1",
             "title": "Luna found 1 issue to improve", "message": "Self-correction pending",
             "approved": false, "issueCount": 1, "severity": "moderate",
             "reviewedAt": "2026-01-01T00:00:00Z"}""";

        client.post().uri("/api/v1/notify/critique")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .exchange()
            .expectStatus().isAccepted();

        ArgumentCaptor<CritiqueReviewNotification> captor = ArgumentCaptor.forClass(CritiqueReviewNotification.class);
        verify(sender).sendCritique(captor.capture());
        assertEquals("turn-1", captor.getValue().turnId());
        assertEquals(Severity.MODERATE, captor.getValue().severity());
        assertFalse(captor.getValue().approved());
    }

    @Test
    @DisplayName("missing turnId is rejected")
    void rejectsMissingTurnId() {
        client.post().uri("/api/v1/notify/critique")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"sessionId\": \"session-1\", \"approved\": true}")
            .exchange()
            .expectStatus().isBadRequest();

        verify(sender, never()).sendCritique(any());
    }

    @Test
    @DisplayName("health answers OK")
    void health() {
        client.get().uri("/api/v1/notify/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
