package com.companionagent.orchestrator.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RouteRequest(
    @JsonProperty("message")   String message,
    @JsonProperty("userId")    String userId,
    @JsonProperty("sessionId") String sessionId
) {}
