package com.companionagent.orchestrator.completion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelCostTableTest {

    @Test
    @DisplayName("cost is priced per 1K input and output tokens")
    void knownModel() {
        // 1500 in at 0.003 + 400 out at 0.015
        assertEquals(0.0105, ModelCostTable.calculateCost("claude-sonnet-4-5-20250929", 1500, 400), 1e-12);
        assertEquals(0.00013, ModelCostTable.calculateCost("llama-3.1-8b-instant", 1000, 1000), 1e-12);
    }

    @Test
    @DisplayName("unlisted or missing model costs nothing")
    void unknownModel() {
        assertEquals(0.0, ModelCostTable.calculateCost("my-local-model", 10_000, 10_000));
        assertEquals(0.0, ModelCostTable.calculateCost((String) null, 10, 10));
        assertEquals(0.0, ModelCostTable.calculateCost((CompletionResult) null));
        assertFalse(ModelCostTable.isKnown("my-local-model"));
    }

    @Test
    @DisplayName("configured default models are priced")
    void defaultsPriced() {
        assertTrue(ModelCostTable.isKnown("claude-haiku-4-5-20251001"));
        assertTrue(ModelCostTable.isKnown("claude-sonnet-4-6"));
        assertTrue(ModelCostTable.isKnown("llama-3.1-8b-instant"));
    }
}
