package com.companionagent.orchestrator.completion;

import java.util.Map;

/**
 * Published list prices in USD per 1K tokens, keyed by provider model id.
 *
 * <p>A model missing from the table costs 0, so cost figures are a lower bound whenever an
 * unlisted model is configured.
 */
public final class ModelCostTable {

    /** Input and output price per 1K tokens. */
    public record Rate(double input, double output) {}

    private static final Map<String, Rate> RATES = Map.ofEntries(
        // OpenAI
        Map.entry("gpt-5.1-chat-latest", new Rate(0.00125, 0.01)),
        Map.entry("gpt-5.1-codex",       new Rate(0.00125, 0.01)),
        Map.entry("gpt-5-mini",          new Rate(0.00025, 0.002)),
        Map.entry("gpt-5-nano",          new Rate(0.00005, 0.0004)),
        Map.entry("gpt-4.1",             new Rate(0.002, 0.008)),
        Map.entry("gpt-4.1-mini",        new Rate(0.0004, 0.0016)),
        Map.entry("gpt-4.1-nano",        new Rate(0.0001, 0.0004)),
        Map.entry("gpt-4o",              new Rate(0.0025, 0.01)),
        Map.entry("gpt-4o-mini",         new Rate(0.00015, 0.0006)),
        Map.entry("o3",                  new Rate(0.002, 0.008)),
        Map.entry("o4-mini",             new Rate(0.0011, 0.0044)),
        // Groq
        Map.entry("llama-3.3-70b-versatile", new Rate(0.00059, 0.00079)),
        Map.entry("llama-3.1-8b-instant",    new Rate(0.00005, 0.00008)),
        // Anthropic
        Map.entry("claude-opus-4-5-20251101",   new Rate(0.005, 0.025)),
        Map.entry("claude-sonnet-4-6",          new Rate(0.003, 0.015)),
        Map.entry("claude-sonnet-4-5-20250929", new Rate(0.003, 0.015)),
        Map.entry("claude-haiku-4-5-20251001",  new Rate(0.001, 0.005)),
        Map.entry("claude-sonnet-4-20250514",   new Rate(0.003, 0.015)),
        Map.entry("claude-3-5-haiku-20241022",  new Rate(0.0008, 0.004)),
        // xAI
        Map.entry("grok-4-1-fast",                      new Rate(0.0002, 0.0005)),
        Map.entry("grok-4-1-fast-reasoning",            new Rate(0.0002, 0.0005)),
        Map.entry("grok-4-1-fast-non-reasoning-latest", new Rate(0.0002, 0.0005)),
        Map.entry("grok-4",                             new Rate(0.003, 0.015)),
        Map.entry("grok-3",                             new Rate(0.003, 0.015)),
        Map.entry("grok-3-mini",                        new Rate(0.0003, 0.0005)),
        // Google
        Map.entry("gemini-2.5-pro-preview-06-05",   new Rate(0.00125, 0.01)),
        Map.entry("gemini-2.5-flash-preview-05-20", new Rate(0.0003, 0.0025)),
        Map.entry("gemini-2.0-flash",               new Rate(0.0001, 0.0004))
    );

    private ModelCostTable() {}

    public static boolean isKnown(String model) {
        return model != null && RATES.containsKey(model);
    }

    /** {@code in/1000 * inputRate + out/1000 * outputRate}, or 0 for an unlisted model. */
    public static double calculateCost(String model, int inputTokens, int outputTokens) {
        Rate rate = model == null ? null : RATES.get(model);
        if (rate == null) return 0.0;
        return (inputTokens / 1000.0) * rate.input() + (outputTokens / 1000.0) * rate.output();
    }

    public static double calculateCost(CompletionResult usage) {
        return usage == null ? 0.0 : calculateCost(usage.model(), usage.inputTokens(), usage.outputTokens());
    }
}
