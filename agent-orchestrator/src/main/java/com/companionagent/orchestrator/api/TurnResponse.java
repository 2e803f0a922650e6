package com.companionagent.orchestrator.api;

import com.companionagent.common.model.RouterDecision;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Delivered turn. {@code decision}, {@code critiqueIssues} and {@code metrics} are omitted
 * when the turn failed before producing them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TurnResponse(
    @JsonProperty("turnId")          String         turnId,
    @JsonProperty("content")         String         content,
    @JsonProperty("success")         boolean        success,
    @JsonProperty("attempts")        int            attempts,
    @JsonProperty("approved")        boolean        approved,
    @JsonProperty("executionTimeMs") long           executionTimeMs,
    @JsonProperty("route")           String         route,
    @JsonProperty("decision")        RouterDecision decision,
    @JsonProperty("critiqueIssues")  List<String>   critiqueIssues,
    @JsonProperty("metrics")         TurnMetrics    metrics
) {
    public static TurnResponse failure(String turnId, String content, long executionTimeMs) {
        return new TurnResponse(turnId, content, false, 0, false, executionTimeMs,
                                null, null, null, null);
    }
}
