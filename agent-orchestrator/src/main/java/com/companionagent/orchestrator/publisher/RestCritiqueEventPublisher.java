package com.companionagent.orchestrator.publisher;

import com.companionagent.common.critique.CritiqueEventPublisher;
import com.companionagent.common.model.CritiqueReviewNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Sends {@link CritiqueReviewNotification}s to notification-service with a fire-and-forget
 * POST. The critique worker never waits on it and never sees its failures.
 */
@Component
public class RestCritiqueEventPublisher implements CritiqueEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestCritiqueEventPublisher.class);

    private final WebClient notificationClient;

    public RestCritiqueEventPublisher(WebClient notificationClient) {
        this.notificationClient = notificationClient;
    }

    @Override
    public void publish(CritiqueReviewNotification notification) {
        notificationClient.post()
            .uri("/api/v1/notify/critique")
            .header("X-Trace-Id", notification.turnId())
            .bodyValue(notification)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("[CritiqueEvents] Review published. turnId={} approved={} severity={} status={}",
                                notification.turnId(), notification.approved(),
                                notification.severity(), r.getStatusCode()),
                err -> log.warn("[CritiqueEvents] Review publish failed (non-critical). turnId={} reason={}",
                                notification.turnId(), err.getMessage())
            );
    }
}
