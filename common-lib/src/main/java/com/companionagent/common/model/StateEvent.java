package com.companionagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One entry of a session's append-only event log. {@code sequence} is dense and
 * strictly increasing per session; replay order is by sequence, never by timestamp.
 */
public record StateEvent(
    @JsonProperty("session_id") String         sessionId,
    @JsonProperty("turn_id")    String         turnId,
    @JsonProperty("type")       StateEventType type,
    @JsonProperty("payload")    String         payload,
    @JsonProperty("sequence")   long           sequence,
    @JsonProperty("timestamp")  Instant        timestamp
) {
    /** Event not yet assigned a position in the log. */
    public static StateEvent pending(String sessionId, String turnId,
                                     StateEventType type, String payload) {
        return new StateEvent(sessionId, turnId, type, payload, 0L, Instant.now());
    }

    public StateEvent atSequence(long sequence) {
        return new StateEvent(sessionId, turnId, type, payload, sequence, timestamp);
    }
}
