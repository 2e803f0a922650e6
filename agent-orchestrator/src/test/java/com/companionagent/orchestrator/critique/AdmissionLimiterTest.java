package com.companionagent.orchestrator.critique;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionLimiterTest {

    private final AtomicLong millis = new AtomicLong(1_000_000L);

    private final Clock clock = new Clock() {
        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant() { return Instant.ofEpochMilli(millis.get()); }
    };

    @Test
    @DisplayName("first permits of a window start immediately")
    void underLimit() {
        AdmissionLimiter limiter = new AdmissionLimiter(3, Duration.ofMinutes(1), clock);
        assertEquals(Duration.ZERO, limiter.reserve());
        assertEquals(Duration.ZERO, limiter.reserve());
        assertEquals(Duration.ZERO, limiter.reserve());
    }

    @Test
    @DisplayName("permit over the limit waits for the oldest slot to leave the window")
    void overLimitWaits() {
        AdmissionLimiter limiter = new AdmissionLimiter(2, Duration.ofMinutes(1), clock);
        limiter.reserve();
        millis.addAndGet(10_000);
        limiter.reserve();
        millis.addAndGet(5_000);

        assertEquals(Duration.ofSeconds(45), limiter.reserve());
        assertEquals(Duration.ofSeconds(55), limiter.reserve());
    }

    @Test
    @DisplayName("slots older than the window are released")
    void windowSlides() {
        AdmissionLimiter limiter = new AdmissionLimiter(1, Duration.ofMinutes(1), clock);
        limiter.reserve();
        millis.addAndGet(60_000);
        assertEquals(Duration.ZERO, limiter.reserve());
    }

    @Test
    @DisplayName("non-positive permit count is rejected")
    void invalid() {
        assertThrows(IllegalArgumentException.class, () -> new AdmissionLimiter(0, Duration.ofMinutes(1), clock));
    }
}
