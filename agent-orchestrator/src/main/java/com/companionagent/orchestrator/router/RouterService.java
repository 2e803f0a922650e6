package com.companionagent.orchestrator.router;

import com.companionagent.common.model.DecisionSource;
import com.companionagent.common.model.IntentClass;
import com.companionagent.common.model.Route;
import com.companionagent.common.model.RouterDecision;
import com.companionagent.common.router.FreshnessCheck;
import com.companionagent.common.router.HardEscalationRules;
import com.companionagent.common.router.IntentClassifier;
import com.companionagent.common.router.IntentClassifier.Classification;
import com.companionagent.common.router.RiskAssessment;
import com.companionagent.common.router.RouteDecisionMatrix;
import com.companionagent.common.router.RouteDecisionMatrix.RouteInput;
import com.companionagent.common.router.RouteDecisionMatrix.RouteOutput;
import com.companionagent.orchestrator.completion.CompletionProviders;
import com.companionagent.orchestrator.completion.CompletionTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Picks the compute tier for one inbound message. Never generates text.
 *
 * <p>Order is fixed: hard escalation (skips everything else), local intent classification
 * with the remote classifier as fallback below {@link IntentClassifier#CONFIDENCE_THRESHOLD},
 * freshness and risk, then the first matching rule of {@link RouteDecisionMatrix}.
 * Every failure on this path degrades toward more scrutiny: a classifier that times out,
 * errors or answers nonsense yields {@code factual}, never {@code chat}.
 */
@Service
public class RouterService {

    private static final Logger log = LoggerFactory.getLogger(RouterService.class);

    /** Caller identity, used only for logging. */
    public record RouterContext(String userId, String sessionId) {}

    static final double CLASSIFIER_CONFIDENCE = 0.8;
    static final String CLASSIFIER_PATTERN    = "classifier_fallback";

    static final String CLASSIFIER_SYSTEM_PROMPT = """
        You are an intent classifier. Classify the user's message into exactly one of these categories:

        - chat: Casual conversation, greetings, opinions, social interaction
        - transform: Requests to rewrite, summarize, translate, or format text
        - factual: Questions seeking explanations, definitions, or static knowledge
        - actionable: Requests that lead to real-world actions (booking, buying, sending, scheduling)

        Respond with ONLY the category name, nothing else. No explanation.

        Examples:
        "hi there" -> chat
        "summarize this article" -> transform
        "what is photosynthesis" -> factual
        "book me a flight to NYC" -> actionable""";

    private final CompletionProviders completionProviders;
    private final ClassifierCache classifierCache;

    @Value("${router.classifier-timeout-ms:2000}")
    private long classifierTimeoutMs = 2000;

    public RouterService(CompletionProviders completionProviders, ClassifierCache classifierCache) {
        this.completionProviders = completionProviders;
        this.classifierCache     = classifierCache;
    }

    /**
     * Routes {@code message}. Produces exactly one decision; never errors.
     */
    public Mono<RouterDecision> route(String message, RouterContext context) {
        return Mono.defer(() -> {
            long startedAt = System.currentTimeMillis();
            classifierCache.maybeSweep();

            HardEscalationRules.EscalationResult escalation = HardEscalationRules.shouldEscalate(message);
            if (escalation != null) {
                RouterDecision decision = RouterDecision.hardEscalation(
                    escalation.matchedPatterns(), System.currentTimeMillis() - startedAt);
                log.info("[Router] Hard escalation. route={} category={} patterns={} sessionId={} timeMs={}",
                         decision.route().wire(), escalation.category(),
                         escalation.matchedPatterns().stream().limit(5).toList(),
                         context.sessionId(), decision.decisionTimeMs());
                return Mono.just(decision);
            }

            Classification local = IntentClassifier.classify(message);
            Mono<Classification> classification = local.isConfident()
                ? Mono.just(local)
                : callClassifier(message).map(intent -> new Classification(
                    intent, CLASSIFIER_CONFIDENCE, DecisionSource.CLASSIFIER, List.of(CLASSIFIER_PATTERN)));

            return classification.map(c -> decide(message, c, startedAt, context));
        });
    }

    /**
     * Rule-only fast path: hard escalation, obvious high or low risk, obvious freshness.
     *
     * @return the route, or {@code null} when the full analysis is required
     */
    public Route quickRouteCheck(String message) {
        if (HardEscalationRules.shouldEscalate(message) != null) {
            return Route.PRO_TOOLS;
        }
        return RouteDecisionMatrix.quickRoute(
            RiskAssessment.obviouslyHighRisk(message),
            RiskAssessment.obviouslyLowRisk(message),
            FreshnessCheck.obviouslyNeedsFreshData(message));
    }

    // ── decision assembly ─────────────────────────────────────────────────────

    private RouterDecision decide(String message, Classification classification,
                                  long startedAt, RouterContext context) {
        List<String> matched = new ArrayList<>(classification.matchedPatterns());

        FreshnessCheck.FreshnessResult freshness = FreshnessCheck.check(message);
        freshness.matchedPatterns().forEach(p -> matched.add("fresh:" + p));

        RiskAssessment.RiskResult risk = RiskAssessment.assess(message);
        risk.matchedPatterns().forEach(p -> matched.add("risk:" + p));

        RouteOutput out = RouteDecisionMatrix.decide(new RouteInput(
            classification.intentClass(), freshness.needsFreshData(),
            risk.riskLevel(), classification.confidence()));

        RouterDecision decision = new RouterDecision(
            classification.intentClass(),
            freshness.needsFreshData(),
            out.needsTools(),
            risk.riskLevel(),
            out.confidenceRequired(),
            out.route(),
            classification.source(),
            System.currentTimeMillis() - startedAt,
            matched);

        log.info("[Router] decision route={} class={} risk={} fresh={} confidence={} source={} "
                 + "reason=\"{}\" sessionId={} timeMs={}",
                 decision.route().wire(), decision.intentClass().wire(), decision.riskIfWrong().wire(),
                 decision.needsFreshData(), decision.confidenceRequired().wire(),
                 decision.decisionSource().wire(), out.reason(), context.sessionId(),
                 decision.decisionTimeMs());
        return decision;
    }

    // ── remote classifier ─────────────────────────────────────────────────────

    /**
     * Cached class when present, else one call racing {@code router.classifier-timeout-ms}.
     * Only successful replies are cached; any failure answers {@code factual}.
     */
    Mono<IntentClass> callClassifier(String message) {
        IntentClass cached = classifierCache.get(message);
        if (cached != null) {
            return Mono.just(cached);
        }

        return completionProviders.complete(CompletionTask.CLASSIFIER, CLASSIFIER_SYSTEM_PROMPT, message, 0.0, 10)
            .timeout(Duration.ofMillis(classifierTimeoutMs))
            .map(result -> {
                IntentClass intent = parseClassifierReply(result.content(), message);
                classifierCache.put(message, intent);
                log.debug("[Router] classifier result class={} tokens={}", intent.wire(), result.totalTokens());
                return intent;
            })
            .onErrorResume(e -> {
                log.warn("[Router] Classifier call failed, using factual. reason={} message=\"{}\"",
                         e.getMessage(), abbreviate(message));
                return Mono.just(IntentClass.FACTUAL);
            })
            .defaultIfEmpty(IntentClass.FACTUAL);
    }

    static IntentClass parseClassifierReply(String reply, String message) {
        String normalised = reply == null ? "" : reply.toLowerCase().trim();
        if (normalised.contains("chat"))       return IntentClass.CHAT;
        if (normalised.contains("transform"))  return IntentClass.TRANSFORM;
        if (normalised.contains("factual"))    return IntentClass.FACTUAL;
        if (normalised.contains("actionable")) return IntentClass.ACTIONABLE;
        log.warn("[Router] Classifier returned unexpected response=\"{}\" message=\"{}\"",
                 normalised, abbreviate(message));
        return IntentClass.FACTUAL;
    }

    private static String abbreviate(String message) {
        return message.length() > 100 ? message.substring(0, 100) : message;
    }
}
