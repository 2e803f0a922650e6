package com.companionagent.orchestrator.critique;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window admission: at most {@code maxPermits} starts per {@code window}.
 * {@link #reserve()} books the next free slot and returns how long the caller must wait for it.
 */
final class AdmissionLimiter {

    private final int maxPermits;
    private final long windowMs;
    private final Clock clock;
    private final Deque<Long> admissions = new ArrayDeque<>();

    AdmissionLimiter(int maxPermits, Duration window, Clock clock) {
        if (maxPermits < 1) throw new IllegalArgumentException("maxPermits must be positive");
        this.maxPermits = maxPermits;
        this.windowMs   = window.toMillis();
        this.clock      = clock;
    }

    synchronized Duration reserve() {
        long now = clock.millis();
        while (!admissions.isEmpty() && admissions.peekFirst() <= now - windowMs) {
            admissions.pollFirst();
        }
        long slot = admissions.size() < maxPermits
            ? now
            : admissions.toArray(new Long[0])[admissions.size() - maxPermits] + windowMs;
        admissions.addLast(slot);
        return Duration.ofMillis(Math.max(0, slot - now));
    }
}
