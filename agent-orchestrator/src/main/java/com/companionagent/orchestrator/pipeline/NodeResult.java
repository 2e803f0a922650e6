package com.companionagent.orchestrator.pipeline;

import com.companionagent.common.model.PipelineState;
import com.companionagent.orchestrator.completion.CompletionResult;

/**
 * Output of one pipeline node: the next state plus the token usage of the model call that
 * produced it ({@code null} when the node made no call or the call failed).
 */
public record NodeResult(PipelineState state, CompletionResult usage) {

    public static NodeResult of(PipelineState state) {
        return new NodeResult(state, null);
    }

    public static NodeResult of(PipelineState state, CompletionResult usage) {
        return new NodeResult(state, usage);
    }

    public int inputTokens() {
        return usage == null ? 0 : usage.inputTokens();
    }

    public int outputTokens() {
        return usage == null ? 0 : usage.outputTokens();
    }
}
