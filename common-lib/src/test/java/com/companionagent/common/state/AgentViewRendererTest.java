package com.companionagent.common.state;

import com.companionagent.common.model.AgentView;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AgentViewRendererTest {

    @Test
    @DisplayName("unset fields are omitted")
    void emptyView() {
        assertEquals("[Current State]\nInteractions this session: 0", AgentViewRenderer.render(null));
    }

    @Test
    @DisplayName("every set field gets its own line")
    void fullView() {
        String block = AgentViewRenderer.render(new AgentView("cooking", "happy", "meal plan", "eat healthier", 4));

        assertEquals("""
            [Current State]
            Topic: cooking
            User mood: happy
            Active task: meal plan
            User goal: eat healthier
            Interactions this session: 4""", block);
    }
}
