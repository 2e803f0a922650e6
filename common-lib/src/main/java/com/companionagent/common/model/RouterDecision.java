package com.companionagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Immutable routing verdict, produced exactly once per inbound message.
 *
 * <p>Two decisions for the same message with a warm classifier cache are equal in every
 * field except {@code decisionTimeMs}; see {@link #sameRouting(RouterDecision)}.
 */
public record RouterDecision(
    @JsonProperty("class")               IntentClass     intentClass,
    @JsonProperty("needs_fresh_data")    boolean         needsFreshData,
    @JsonProperty("needs_tools")         boolean         needsTools,
    @JsonProperty("risk_if_wrong")       RiskLevel       riskIfWrong,
    @JsonProperty("confidence_required") ConfidenceLevel confidenceRequired,
    @JsonProperty("route")               Route           route,
    @JsonProperty("decision_source")     DecisionSource  decisionSource,
    @JsonProperty("decision_time_ms")    long            decisionTimeMs,
    @JsonProperty("matched_patterns")    List<String>    matchedPatterns
) {
    public RouterDecision {
        matchedPatterns = matchedPatterns == null ? List.of() : List.copyOf(matchedPatterns);
    }

    /** Decision forced by a hard-escalation pattern: highest tier, tools, verified. */
    public static RouterDecision hardEscalation(List<String> matchedPatterns, long decisionTimeMs) {
        return new RouterDecision(
            IntentClass.ACTIONABLE, true, true, RiskLevel.HIGH,
            ConfidenceLevel.VERIFIED, Route.PRO_TOOLS, DecisionSource.HARD_RULE,
            decisionTimeMs, matchedPatterns);
    }

    /** {@code true} when both decisions agree on every field except the timing. */
    public boolean sameRouting(RouterDecision other) {
        return other != null
            && intentClass == other.intentClass
            && needsFreshData == other.needsFreshData
            && needsTools == other.needsTools
            && riskIfWrong == other.riskIfWrong
            && confidenceRequired == other.confidenceRequired
            && route == other.route
            && decisionSource == other.decisionSource
            && matchedPatterns.equals(other.matchedPatterns);
    }
}
