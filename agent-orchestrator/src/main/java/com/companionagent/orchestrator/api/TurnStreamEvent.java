package com.companionagent.orchestrator.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Event of {@code POST /api/v1/turns/stream}: one {@code status}, one {@code content}, one {@code done}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TurnStreamEvent(
    @JsonProperty("type")       String      type,
    @JsonProperty("content")    String      content,
    @JsonProperty("turnId")     String      turnId,
    @JsonProperty("attempts")   Integer     attempts,
    @JsonProperty("tokensUsed") Integer     tokensUsed,
    @JsonProperty("metrics")    TurnMetrics metrics
) {
    public static final String PREPARING = "Preparing response...";

    public static TurnStreamEvent status(String text) {
        return new TurnStreamEvent("status", text, null, null, null, null);
    }

    public static TurnStreamEvent content(String text) {
        return new TurnStreamEvent("content", text, null, null, null, null);
    }

    public static TurnStreamEvent done(TurnResponse response) {
        TurnMetrics m = response.metrics();
        return new TurnStreamEvent("done", null, response.turnId(), response.attempts(),
                                   m == null ? 0 : m.totalTokens(), m);
    }
}
