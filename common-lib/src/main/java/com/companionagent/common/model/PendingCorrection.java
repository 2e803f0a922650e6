package com.companionagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Durable record of a delivered response that failed asynchronous review.
 * Created only for rejected critique jobs; consumed once by a later turn of the session.
 */
public record PendingCorrection(
    @JsonProperty("id")                Long         id,
    @JsonProperty("session_id")        String       sessionId,
    @JsonProperty("turn_id")           String       turnId,
    @JsonProperty("severity")          Severity     severity,
    @JsonProperty("issues")            List<String> issues,
    @JsonProperty("fix_instructions")  String       fixInstructions,
    @JsonProperty("original_response") String       originalResponse,
    @JsonProperty("processed")         boolean      processed
) {
    public PendingCorrection {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
