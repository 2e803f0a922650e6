package com.companionagent.orchestrator.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One inbound chat message.
 *
 * @param mode requested wire mode; unknown or missing values run as {@code assistant}
 */
public record TurnRequest(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("userId")    String userId,
    @JsonProperty("message")   String message,
    @JsonProperty("mode")      String mode,
    @JsonProperty("source")    String source
) {}
