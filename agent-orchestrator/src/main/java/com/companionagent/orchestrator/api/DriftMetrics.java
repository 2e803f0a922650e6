package com.companionagent.orchestrator.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Behaviour of one identity version on one UTC day. A rising repair rate or failed-critique
 * count after a version change points at the new rules.
 *
 * @param repairTurns turns that needed at least one repair ({@code attempts > 1})
 */
public record DriftMetrics(
    @JsonProperty("day")                LocalDate day,
    @JsonProperty("identityId")         String    identityId,
    @JsonProperty("identityVersion")    int       identityVersion,
    @JsonProperty("totalTurns")         long      totalTurns,
    @JsonProperty("repairTurns")        long      repairTurns,
    @JsonProperty("repairRatePct")      double    repairRatePct,
    @JsonProperty("avgAttempts")        double    avgAttempts,
    @JsonProperty("failedCritiques")    long      failedCritiques,
    @JsonProperty("avgExecutionTimeMs") long      avgExecutionTimeMs
) {}
