package com.companionagent.common.router;

import com.companionagent.common.model.ConfidenceLevel;
import com.companionagent.common.model.IntentClass;
import com.companionagent.common.model.RiskLevel;
import com.companionagent.common.model.Route;

/**
 * Ordered decision rules mapping (class, freshness, risk, confidence) to a route.
 * The first matching rule wins; when nothing else applies the message escalates to {@code pro}.
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class RouteDecisionMatrix {

    public record RouteInput(IntentClass intentClass, boolean needsFreshData,
                             RiskLevel riskLevel, double classificationConfidence) {}

    public record RouteOutput(Route route, ConfidenceLevel confidenceRequired,
                              boolean needsTools, String reason) {

        static RouteOutput withTools(String reason) {
            return new RouteOutput(Route.PRO_TOOLS, ConfidenceLevel.VERIFIED, true, reason);
        }

        static RouteOutput pro(String reason) {
            return new RouteOutput(Route.PRO, ConfidenceLevel.ESTIMATE, false, reason);
        }

        static RouteOutput nano(String reason) {
            return new RouteOutput(Route.NANO, ConfidenceLevel.ESTIMATE, false, reason);
        }
    }

    private RouteDecisionMatrix() {}

    public static RouteOutput decide(RouteInput in) {
        IntentClass c = in.intentClass();

        if (in.riskLevel() == RiskLevel.HIGH) {
            return RouteOutput.withTools("High risk - wrong answer has real cost");
        }
        if (c == IntentClass.ACTIONABLE && in.needsFreshData()) {
            return RouteOutput.withTools("Actionable intent with fresh data requirement");
        }
        if (c == IntentClass.ACTIONABLE) {
            return RouteOutput.withTools("Actionable intent - real-world action");
        }
        if (c == IntentClass.FACTUAL && in.needsFreshData()) {
            return RouteOutput.withTools("Factual query requiring current data");
        }
        if (in.riskLevel() == RiskLevel.MEDIUM) {
            return RouteOutput.pro("Medium risk - needs reasoning depth");
        }
        if (in.classificationConfidence() < IntentClassifier.CONFIDENCE_THRESHOLD) {
            return RouteOutput.pro("Low classification confidence - escalating");
        }
        if (c == IntentClass.CHAT) {
            return RouteOutput.nano("Casual conversation");
        }
        if (c == IntentClass.TRANSFORM) {
            return RouteOutput.nano("Transform task - user will verify result");
        }
        if (c == IntentClass.FACTUAL) {
            return RouteOutput.pro("Factual explanation - needs reasoning depth");
        }
        return RouteOutput.pro("Default escalation - fail safe");
    }

    /**
     * Fast path for obvious cases.
     *
     * @return the route, or {@code null} when full analysis is required
     */
    public static Route quickRoute(boolean obviouslyHighRisk, boolean obviouslyLowRisk, boolean needsFreshData) {
        if (obviouslyHighRisk) return Route.PRO_TOOLS;
        if (obviouslyLowRisk && !needsFreshData) return Route.NANO;
        return null;
    }

    /** {@code false} when a route under-serves the message's constraints. */
    public static boolean validate(Route route, RiskLevel riskLevel, boolean needsFreshData, IntentClass intentClass) {
        if (riskLevel == RiskLevel.HIGH && route != Route.PRO_TOOLS) return false;
        if (needsFreshData && intentClass == IntentClass.ACTIONABLE && route != Route.PRO_TOOLS) return false;
        return !(needsFreshData && route == Route.NANO);
    }
}
