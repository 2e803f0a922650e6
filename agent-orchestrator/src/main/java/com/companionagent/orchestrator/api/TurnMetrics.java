package com.companionagent.orchestrator.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Token, cost and timing figures of one turn, summed over its completed model calls. */
public record TurnMetrics(
    @JsonProperty("promptTokens")     int          promptTokens,
    @JsonProperty("completionTokens") int          completionTokens,
    @JsonProperty("cacheTokens")      int          cacheTokens,
    @JsonProperty("llmCalls")         int          llmCalls,
    @JsonProperty("estimatedCost")    double       estimatedCost,
    @JsonProperty("processingTimeMs") long         processingTimeMs,
    @JsonProperty("tokensPerSecond")  double       tokensPerSecond,
    @JsonProperty("nodesExecuted")    List<String> nodesExecuted
) {
    public static TurnMetrics of(int promptTokens, int completionTokens, int cacheTokens, int llmCalls,
                                 double estimatedCost, long processingTimeMs, List<String> nodesExecuted) {
        double tps = processingTimeMs > 0 ? completionTokens / (processingTimeMs / 1000.0) : 0.0;
        return new TurnMetrics(promptTokens, completionTokens, cacheTokens, llmCalls, estimatedCost,
                               processingTimeMs, Math.round(tps * 10) / 10.0, nodesExecuted);
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }
}
