package com.companionagent.orchestrator.completion;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Remote chat-completion capability. Implementations own their HTTP client, credentials
 * and per-call timeout; they signal every failure as an error and never return a fallback
 * text, so each pipeline node decides how to degrade.
 */
public interface CompletionProvider {

    /** Registry key, e.g. {@code anthropic}, {@code groq}, {@code openai}. */
    String name();

    boolean isConfigured();

    Mono<CompletionResult> complete(CompletionRequest request);

    Flux<CompletionChunk> stream(CompletionRequest request);
}
