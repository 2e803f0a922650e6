package com.companionagent.orchestrator.pipeline;

import com.companionagent.common.model.PipelineNode;
import com.companionagent.orchestrator.completion.CompletionResult;
import com.companionagent.orchestrator.completion.ModelCostTable;

/**
 * One completed model call made by a node during a turn.
 *
 * @param sequence   1-based position of the call within the turn
 * @param durationMs wall time of the node that made the call
 */
public record LlmCall(PipelineNode node, int sequence, CompletionResult usage, long durationMs) {

    public String nodeName() {
        return node.name().toLowerCase();
    }

    public double estimatedCost() {
        return ModelCostTable.calculateCost(usage);
    }
}
