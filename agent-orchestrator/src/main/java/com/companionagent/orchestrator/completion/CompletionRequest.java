package com.companionagent.orchestrator.completion;

import java.util.List;

/**
 * Provider-neutral completion call: one optional system prompt plus ordered chat messages.
 */
public record CompletionRequest(
    String        model,
    String        system,
    List<Message> messages,
    double        temperature,
    int           maxTokens
) {
    public CompletionRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public record Message(String role, String content) {
        public static Message user(String content) {
            return new Message("user", content);
        }
    }

    /** Single-turn request: system prompt plus one user message. */
    public static CompletionRequest of(String model, String system, String user,
                                       double temperature, int maxTokens) {
        return new CompletionRequest(model, system, List.of(Message.user(user)), temperature, maxTokens);
    }
}
