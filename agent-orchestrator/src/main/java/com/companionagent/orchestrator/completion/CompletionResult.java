package com.companionagent.orchestrator.completion;

/**
 * Text and token accounting of one completed provider call.
 * {@code cacheTokens} is 0 when the provider does not report prompt caching.
 */
public record CompletionResult(
    String content,
    int    inputTokens,
    int    outputTokens,
    int    cacheTokens,
    String model,
    String provider
) {
    public int totalTokens() {
        return inputTokens + outputTokens;
    }

    public boolean isBlank() {
        return content == null || content.isBlank();
    }
}
