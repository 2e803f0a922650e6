package com.companionagent.orchestrator.logger;

import com.companionagent.common.model.PipelineState;
import com.companionagent.common.model.RouterDecision;
import com.companionagent.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of a turn's journey through the pipeline. Pure side-effects; never
 * changes pipeline behaviour.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #TURN_RECEIVED}: message accepted, identity pinned</li>
 *   <li>{@link #ROUTED}: router produced its decision</li>
 *   <li>{@link #STATE_ADVANCED}: event log appended, view recomputed, memories attached</li>
 *   <li>{@link #PLANNED}: plan set (model or fallback)</li>
 *   <li>{@link #DRAFTED}: first draft generated</li>
 *   <li>{@link #SUPERVISED}: one review completed</li>
 *   <li>{@link #REPAIRED}: one repair attempt completed</li>
 *   <li>{@link #FORCE_ACCEPTED}: attempts exhausted or timed out, draft accepted as is</li>
 *   <li>{@link #DELIVERED}: final output returned to the caller</li>
 *   <li>{@link #CRITIQUE_ENQUEUED}: turn handed to the background critique queue</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads the turn id from the Reactor Context):
 * <pre>
 *     .doOnEach(turnFlowLogger.stage(TurnFlowLogger.ROUTED))
 * </pre>
 */
@Component
public class TurnFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(TurnFlowLogger.class);

    public static final String TURN_RECEIVED     = "TURN_RECEIVED";
    public static final String ROUTED            = "ROUTED";
    public static final String STATE_ADVANCED    = "STATE_ADVANCED";
    public static final String PLANNED           = "PLANNED";
    public static final String DRAFTED           = "DRAFTED";
    public static final String SUPERVISED        = "SUPERVISED";
    public static final String REPAIRED          = "REPAIRED";
    public static final String FORCE_ACCEPTED    = "FORCE_ACCEPTED";
    public static final String DELIVERED         = "DELIVERED";
    public static final String CRITIQUE_ENQUEUED = "CRITIQUE_ENQUEUED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on {@code onNext} only.
     * The turn id is read from the signal's context and bridged into MDC for the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId   = TraceContextUtil.getTraceId(signal.getContextView());
            String sessionId = TraceContextUtil.getSessionId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[TurnFlow] stage={} sessionId={} traceId={}", stageName, sessionId, traceId)
            );
        };
    }

    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[TurnFlow] stage={} traceId={}", stageName, traceId)
        );
    }

    /** Node transition inside the pipeline loop, with the counters that bound it. */
    public void logNode(String stageName, PipelineState state) {
        TraceContextUtil.withMdc(state.turnId(), () ->
            log.info("[TurnFlow] stage={} attempts={} issues={} hasDraft={} traceId={}",
                     stageName, state.attempts(), state.critiqueIssues().size(),
                     state.draft() != null, state.turnId())
        );
    }

    public void logDecision(RouterDecision decision, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[TurnFlow] stage={} route={} class={} risk={} fresh={} source={} timeMs={} traceId={}",
                     ROUTED, decision.route().wire(), decision.intentClass(), decision.riskIfWrong(),
                     decision.needsFreshData(), decision.decisionSource(), decision.decisionTimeMs(),
                     traceId)
        );
    }
}
