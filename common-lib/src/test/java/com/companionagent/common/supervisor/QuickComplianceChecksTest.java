package com.companionagent.common.supervisor;

import com.companionagent.common.model.AgentMode;
import com.companionagent.common.model.SupervisorVerdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuickComplianceChecksTest {

    @Test
    @DisplayName("clean draft passes")
    void clean() {
        assertNull(QuickComplianceChecks.check("Hey! Good to see you.", AgentMode.COMPANION, List.of()));
    }

    @Test
    @DisplayName("em dash is rejected in every mode")
    void emDash() {
        for (AgentMode mode : AgentMode.values()) {
            SupervisorVerdict v = QuickComplianceChecks.check("Sure — here it is", mode, List.of());
            assertNotNull(v);
            assertFalse(v.approved());
            assertEquals(List.of(QuickComplianceChecks.EM_DASH_ISSUE), v.issues());
        }
    }

    @Test
    @DisplayName("600-character voice draft with fences → markdown and length issues")
    void voiceMarkdownAndLength() {
        String draft = "```" + "a".repeat(594) + "```";
        assertEquals(600, draft.length());

        SupervisorVerdict v = QuickComplianceChecks.check(draft, AgentMode.VOICE, List.of());

        assertNotNull(v);
        assertFalse(v.approved());
        assertTrue(v.issues().contains(QuickComplianceChecks.MARKDOWN_ISSUE));
        assertTrue(v.issues().contains(QuickComplianceChecks.TOO_LONG_ISSUE));
        assertEquals("1. Fix: " + v.issues().get(0) + "; 2. Fix: " + v.issues().get(1), v.fixInstructions());
    }

    @Test
    @DisplayName("markdown and length limits apply to short-form modes only")
    void longFormAllowsMarkdown() {
        assertNull(QuickComplianceChecks.check("## Title\n**bold** " + "x".repeat(700), AgentMode.ASSISTANT, List.of()));
    }

    @Test
    @DisplayName("tool claims need a memory that mentions search or calendar")
    void toolHallucination() {
        String draft = "According to my search, the museum opens at nine.";
        SupervisorVerdict v = QuickComplianceChecks.check(draft, AgentMode.ASSISTANT, List.of("user likes museums"));
        assertNotNull(v);
        assertEquals(List.of(QuickComplianceChecks.HALLUCINATION_ISSUE), v.issues());

        assertNull(QuickComplianceChecks.check(draft, AgentMode.ASSISTANT, List.of("web search: museum hours 9-5")));
    }
}
