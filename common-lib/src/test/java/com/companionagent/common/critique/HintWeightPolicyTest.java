package com.companionagent.common.critique;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class HintWeightPolicyTest {

    @Nested
    @DisplayName("reinforce()")
    class Reinforce {

        @Test
        @DisplayName("weight never decreases and never exceeds the cap")
        void monotoneAndCapped() {
            double w = HintWeightPolicy.INITIAL_WEIGHT;
            for (int i = 0; i < 20; i++) {
                double next = HintWeightPolicy.reinforce(w);
                assertTrue(next >= w, "weight decreased on recurrence " + i);
                assertTrue(next <= HintWeightPolicy.MAX_WEIGHT, "weight above cap on recurrence " + i);
                w = next;
            }
            assertEquals(HintWeightPolicy.MAX_WEIGHT, w, 1e-9);
        }

        @Test
        @DisplayName("one step adds 0.2")
        void step() {
            assertEquals(1.2, HintWeightPolicy.reinforce(1.0), 1e-9);
        }
    }

    @Nested
    @DisplayName("decay()")
    class Decay {

        private final Instant now = Instant.parse("2024-06-15T12:00:00Z");

        @Test
        @DisplayName("hints seen within a day keep their weight")
        void recent() {
            assertEquals(1.4, HintWeightPolicy.decay(1.4, now.minus(Duration.ofHours(12)), now, 7), 1e-9);
        }

        @Test
        @DisplayName("two decay periods → 0.9^2")
        void twoPeriods() {
            assertEquals(0.81, HintWeightPolicy.decay(1.0, now.minus(Duration.ofDays(14)), now, 7), 1e-9);
        }

        @Test
        @DisplayName("decay stops at the floor")
        void floor() {
            assertEquals(HintWeightPolicy.DECAY_FLOOR,
                HintWeightPolicy.decay(0.3, now.minus(Duration.ofDays(3650)), now, 7), 1e-9);
        }
    }
}
