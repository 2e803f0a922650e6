package com.companionagent.common.critique;

import java.time.Duration;
import java.time.Instant;

/**
 * Weight arithmetic for user-scoped hints.
 *
 * <p>Recurrence only ever raises a weight, up to {@link #MAX_WEIGHT}. Decay applies to hints
 * not seen for over a day and never goes below {@link #DECAY_FLOOR}; hints under
 * {@link #PRUNE_BELOW} are removed by maintenance.
 */
public final class HintWeightPolicy {

    public static final double INITIAL_WEIGHT = 1.0;
    public static final double STEP           = 0.2;
    public static final double MAX_WEIGHT     = 2.0;
    public static final double DECAY_FACTOR   = 0.9;
    public static final double DECAY_FLOOR    = 0.1;
    public static final double PRUNE_BELOW    = 0.15;

    /** Minimum weight for a user hint to be injected. */
    public static final double INJECT_MIN     = 0.3;
    /** User hints at or above this weight get an {@code IMPORTANT:} prefix. */
    public static final double IMPORTANT_AT   = 1.5;

    private HintWeightPolicy() {}

    public static double reinforce(double current) {
        return Math.min(MAX_WEIGHT, current + STEP);
    }

    /**
     * {@code max(0.1, w * 0.9^(ageDays / decayDays))} for hints last seen more than a day ago;
     * younger hints keep their weight.
     */
    public static double decay(double weight, Instant lastSeen, Instant now, int decayDays) {
        if (lastSeen == null || decayDays <= 0) return weight;
        double ageDays = Duration.between(lastSeen, now).toMillis() / 86_400_000.0;
        if (ageDays <= 1.0) return weight;
        return Math.max(DECAY_FLOOR, weight * Math.pow(DECAY_FACTOR, ageDays / decayDays));
    }
}
