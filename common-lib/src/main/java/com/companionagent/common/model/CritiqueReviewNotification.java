package com.companionagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Outcome of one asynchronous review, sent to notification-service.
 */
public record CritiqueReviewNotification(
    @JsonProperty("userId")     String   userId,
    @JsonProperty("sessionId")  String   sessionId,
    @JsonProperty("turnId")     String   turnId,
    @JsonProperty("title")      String   title,
    @JsonProperty("message")    String   message,
    @JsonProperty("approved")   boolean  approved,
    @JsonProperty("issueCount") int      issueCount,
    @JsonProperty("severity")   Severity severity,
    @JsonProperty("reviewedAt") Instant  reviewedAt
) {
    /**
     * Builds the user-facing title and message for a review outcome.
     *
     * @param agentName display name of the identity that produced the response
     */
    public static CritiqueReviewNotification of(String agentName, CritiqueJob job,
                                                CritiqueJobResult result) {
        int issueCount = result.issues().size();
        String title = result.approved()
            ? agentName + " reviewed the response"
            : agentName + " found " + issueCount + " issue" + (issueCount == 1 ? "" : "s") + " to improve";
        String message = result.approved() ? "Response quality verified" : "Self-correction pending";
        return new CritiqueReviewNotification(job.userId(), job.sessionId(), job.turnId(),
            title, message, result.approved(), issueCount, result.severity(), Instant.now());
    }
}
