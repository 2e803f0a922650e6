package com.companionagent.orchestrator.pipeline;

import com.companionagent.common.model.PipelineNode;
import com.companionagent.common.model.PipelineState;

import java.util.List;

/**
 * Outcome of one pipeline run.
 *
 * @param approved      the last review approved the delivered draft (false when force-accepted)
 * @param nodesExecuted nodes in execution order, state manager excluded
 * @param llmCalls      completed model calls in call order; failed calls are not listed
 * @param timedOut      the turn hit {@code pipeline.turn-timeout-ms}
 */
public record TurnResult(
    PipelineState      state,
    String             output,
    boolean            approved,
    List<PipelineNode> nodesExecuted,
    List<LlmCall>      llmCalls,
    int                inputTokens,
    int                outputTokens,
    long               totalDurationMs,
    boolean            timedOut
) {
    public TurnResult {
        nodesExecuted = nodesExecuted == null ? List.of() : List.copyOf(nodesExecuted);
        llmCalls      = llmCalls == null ? List.of() : List.copyOf(llmCalls);
    }

    public int cacheTokens() {
        return llmCalls.stream().mapToInt(c -> c.usage().cacheTokens()).sum();
    }

    public double estimatedCost() {
        return llmCalls.stream().mapToDouble(LlmCall::estimatedCost).sum();
    }

    public boolean success() {
        return output != null;
    }
}
