package com.companionagent.common.router;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HardEscalationRulesTest {

    @Nested
    @DisplayName("shouldEscalate()")
    class ShouldEscalateTests {

        @Test
        @DisplayName("travel booking with a near-future date escalates on both groups")
        void flightTomorrow() {
            HardEscalationRules.EscalationResult r =
                HardEscalationRules.shouldEscalate("book me a flight to NYC tomorrow");

            assertNotNull(r);
            assertTrue(r.triggered());
            assertTrue(r.matchedPatterns().contains("temporal:near_future"));
            assertTrue(r.matchedPatterns().contains("travel:flight"));
            assertTrue(r.matchedPatterns().contains("travel:booking"));
            assertEquals(HardEscalationRules.Category.TEMPORAL, r.category());
        }

        @Test
        @DisplayName("weather question escalates")
        void weather() {
            HardEscalationRules.EscalationResult r =
                HardEscalationRules.shouldEscalate("what's the weather tomorrow");
            assertNotNull(r);
            assertTrue(r.matchedPatterns().contains("weather:weather"));
        }

        @Test
        @DisplayName("short greeting mentioning today is exempt")
        void greetingExempt() {
            assertNull(HardEscalationRules.shouldEscalate("how are you today"));
            assertTrue(HardEscalationRules.check("how are you today").triggered());
        }

        @Test
        @DisplayName("long message opening with a greeting is not exempt")
        void longGreetingNotExempt() {
            String msg = "hey, can you tell me what the bitcoin price is looking like right now";
            assertFalse(HardEscalationRules.isPrimaryGreeting(msg));
            assertNotNull(HardEscalationRules.shouldEscalate(msg));
        }

        @Test
        @DisplayName("conceptual question does not escalate")
        void conceptual() {
            assertNull(HardEscalationRules.shouldEscalate("explain recursion in programming"));
        }

        @Test
        @DisplayName("matching ignores case and surrounding whitespace")
        void caseInsensitive() {
            assertNotNull(HardEscalationRules.shouldEscalate("   WHAT IS THE BITCOIN PRICE   "));
        }
    }
}
