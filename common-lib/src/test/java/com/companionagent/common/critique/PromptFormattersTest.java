package com.companionagent.common.critique;

import com.companionagent.common.model.Hint;
import com.companionagent.common.model.HintScope;
import com.companionagent.common.model.PendingCorrection;
import com.companionagent.common.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PromptFormattersTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    private static Hint user(String type, String text, double weight) {
        return new Hint(HintScope.USER, type, text, weight, 3, NOW);
    }

    private static PendingCorrection correction(Severity severity, String... issues) {
        return new PendingCorrection(1L, "s1", "t1", severity, List.of(issues), "", "old", false);
    }

    @Nested
    @DisplayName("HintPromptFormatter")
    class Hints {

        @Test
        @DisplayName("no hints → null")
        void none() {
            assertNull(HintPromptFormatter.format(List.of(), List.of()));
        }

        @Test
        @DisplayName("session hints first, duplicates by type dropped, heavy user hints marked")
        void ordering() {
            String out = HintPromptFormatter.format(
                List.of(Hint.session("avoid_verbose", "Keep responses concise and to the point", NOW)),
                List.of(user("avoid_verbose", "Keep responses concise and to the point", 1.8),
                        user("avoid_formal", "Use casual, friendly tone - not overly formal", 1.6),
                        user("avoid_robotic", "Sound natural and human, not robotic", 1.0)));

            assertEquals(HintPromptFormatter.HEADER + "\n"
                + "- Keep responses concise and to the point\n"
                + "- IMPORTANT: Use casual, friendly tone - not overly formal\n"
                + "- Sound natural and human, not robotic", out);
        }
    }

    @Nested
    @DisplayName("CorrectionPromptFormatter")
    class Corrections {

        @Test
        @DisplayName("serious corrections ask for explicit acknowledgement of at most 3 issues")
        void serious() {
            String out = CorrectionPromptFormatter.format(List.of(
                correction(Severity.MODERATE, "m1"),
                correction(Severity.SERIOUS, "a", "b", "c", "d")));

            assertTrue(out.startsWith("[Self-Correction Required]"));
            assertTrue(out.contains("acknowledging and correcting: a; b; c."));
            assertFalse(out.contains("[Subtle Improvement Needed]"));
        }

        @Test
        @DisplayName("moderate only → subtle block with at most 2 issues")
        void moderate() {
            String out = CorrectionPromptFormatter.format(List.of(correction(Severity.MODERATE, "x", "y", "z")));
            assertTrue(out.startsWith("[Subtle Improvement Needed]"));
            assertTrue(out.contains("improvements for: x; y."));
        }

        @Test
        @DisplayName("minor only or nothing → null")
        void minor() {
            assertNull(CorrectionPromptFormatter.format(List.of(correction(Severity.MINOR))));
            assertNull(CorrectionPromptFormatter.format(List.of()));
        }
    }
}
