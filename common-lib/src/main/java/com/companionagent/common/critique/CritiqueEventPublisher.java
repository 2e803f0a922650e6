package com.companionagent.common.critique;

import com.companionagent.common.model.CritiqueReviewNotification;

/**
 * Publishes the outcome of an asynchronous review.
 *
 * <p>Current implementation: {@code RestCritiqueEventPublisher}, a fire-and-forget
 * WebClient call to notification-service.
 */
public interface CritiqueEventPublisher {

    /**
     * Must be non-blocking and must never throw; a lost notification never fails the job.
     */
    void publish(CritiqueReviewNotification notification);
}
