package com.companionagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Pre-ranked memory blocks returned by the memory provider for one turn.
 * Any block may be {@code null} or blank when the provider has nothing for it.
 */
public record MemoryContext(
    @JsonProperty("facts")          String facts,
    @JsonProperty("recent_actions") String recentActions,
    @JsonProperty("conversations")  String conversations
) {
    public static MemoryContext empty() {
        return new MemoryContext(null, null, null);
    }

    /**
     * Blocks in prompt order: facts and recent actions first, conversation history last.
     */
    public List<String> orderedBlocks() {
        List<String> blocks = new ArrayList<>(3);
        if (facts != null && !facts.isBlank())                 blocks.add(facts);
        if (recentActions != null && !recentActions.isBlank()) blocks.add(recentActions);
        if (conversations != null && !conversations.isBlank()) {
            blocks.add("[Relevant Past Conversations]\n" + conversations);
        }
        return blocks;
    }
}
