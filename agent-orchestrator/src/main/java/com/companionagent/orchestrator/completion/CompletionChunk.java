package com.companionagent.orchestrator.completion;

/**
 * Element of a streamed completion: content deltas, then exactly one terminal chunk
 * carrying the accumulated {@link CompletionResult}.
 */
public record CompletionChunk(String delta, boolean done, CompletionResult summary) {

    public static CompletionChunk delta(String text) {
        return new CompletionChunk(text, false, null);
    }

    public static CompletionChunk done(CompletionResult summary) {
        return new CompletionChunk("", true, summary);
    }
}
