package com.companionagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Typed behavioural correction learned from critique and injected into later prompts.
 * Session hints always have weight 1.0 and a single occurrence.
 */
public record Hint(
    @JsonProperty("scope")            HintScope scope,
    @JsonProperty("type")             String    type,
    @JsonProperty("text")             String    text,
    @JsonProperty("weight")           double    weight,
    @JsonProperty("occurrence_count") int       occurrenceCount,
    @JsonProperty("last_seen")        Instant   lastSeen
) {
    public static Hint session(String type, String text, Instant createdAt) {
        return new Hint(HintScope.SESSION, type, text, 1.0, 1, createdAt);
    }
}
