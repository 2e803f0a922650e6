package com.companionagent.orchestrator.service;

import com.companionagent.common.identity.IdentityProfile;
import com.companionagent.common.identity.ModeSwitchDetector;
import com.companionagent.common.model.AgentMode;
import com.companionagent.common.model.AgentView;
import com.companionagent.common.model.CritiqueJob;
import com.companionagent.common.model.PipelineState;
import com.companionagent.common.model.RouterDecision;
import com.companionagent.common.trace.TraceContextUtil;
import com.companionagent.orchestrator.api.TurnMetrics;
import com.companionagent.orchestrator.api.TurnRequest;
import com.companionagent.orchestrator.api.TurnResponse;
import com.companionagent.orchestrator.api.TurnStreamEvent;
import com.companionagent.orchestrator.critique.CritiqueQueue;
import com.companionagent.orchestrator.critique.HintInjectionService;
import com.companionagent.orchestrator.critique.SelfCorrectionService;
import com.companionagent.orchestrator.critique.SelfCorrectionService.CorrectionPrompt;
import com.companionagent.orchestrator.identity.IdentityService;
import com.companionagent.orchestrator.logger.TurnFlowLogger;
import com.companionagent.orchestrator.model.AgentTurnRecord;
import com.companionagent.orchestrator.pipeline.GeneratorNode;
import com.companionagent.orchestrator.pipeline.TurnPipelineEngine;
import com.companionagent.orchestrator.pipeline.TurnResult;
import com.companionagent.orchestrator.router.RouterService;
import com.companionagent.orchestrator.router.RouterService.RouterContext;
import com.companionagent.orchestrator.state.EventLogService;
import com.companionagent.orchestrator.state.TurnLogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

/**
 * Entry point for one chat turn:
 * <pre>
 *   pin identity → mode switch → route → hints + corrections → pipeline → deliver
 *   deliver: swap error drafts for fallback text → turn log → critique enqueue → consume corrections
 * </pre>
 * Never fails: any error answers {@link #FAILURE_TEXT}. The critique enqueue is
 * fire-and-forget and never delays the response.
 */
@Service
public class ChatTurnService {

    private static final Logger log = LoggerFactory.getLogger(ChatTurnService.class);

    public static final String FAILURE_TEXT   = "I'm sorry, something went wrong. Please try again.";
    public static final String NO_OUTPUT_TEXT = "I'm sorry, I couldn't generate a response.";

    private final IdentityService identityService;
    private final RouterService routerService;
    private final HintInjectionService hintService;
    private final SelfCorrectionService correctionService;
    private final TurnPipelineEngine engine;
    private final TurnLogService turnLog;
    private final EventLogService eventLog;
    private final CritiqueQueue critiqueQueue;
    private final TurnFlowLogger flowLogger;

    public ChatTurnService(IdentityService identityService, RouterService routerService,
                           HintInjectionService hintService, SelfCorrectionService correctionService,
                           TurnPipelineEngine engine, TurnLogService turnLog, EventLogService eventLog,
                           CritiqueQueue critiqueQueue, TurnFlowLogger flowLogger) {
        this.identityService   = identityService;
        this.routerService     = routerService;
        this.hintService       = hintService;
        this.correctionService = correctionService;
        this.engine            = engine;
        this.turnLog           = turnLog;
        this.eventLog          = eventLog;
        this.critiqueQueue     = critiqueQueue;
        this.flowLogger        = flowLogger;
    }

    public Mono<TurnResponse> processTurn(TurnRequest request) {
        String turnId = UUID.randomUUID().toString();
        long startedAt = System.currentTimeMillis();

        Mono<TurnResponse> flow = Mono.just(request)
            .doOnNext(r -> log.info("[Turn] Processing started. sessionId={} userId={} turnId={} mode={} "
                                    + "source={} messageLength={}", r.sessionId(), r.userId(), turnId, r.mode(),
                                    r.source(), r.message() == null ? 0 : r.message().length()))
            .flatMap(r -> identityService.ensureSessionIdentity(r.sessionId()))
            .doOnEach(flowLogger.stage(TurnFlowLogger.TURN_RECEIVED))
            .flatMap(identity -> {
                AgentMode mode = resolveMode(request, identity);
                return routerService.route(request.message(), new RouterContext(request.userId(), request.sessionId()))
                    .doOnNext(decision -> flowLogger.logDecision(decision, turnId))
                    .flatMap(decision -> Mono.zip(
                            hintService.getFormattedHints(request.sessionId(), request.userId()).defaultIfEmpty(""),
                            correctionService.getFormattedCorrectionPrompt(request.sessionId()))
                        .flatMap(feedback -> {
                            String hints = feedback.getT1().isEmpty() ? null : feedback.getT1();
                            CorrectionPrompt correction = feedback.getT2();
                            PipelineState initial = PipelineState.initial(request.sessionId(), turnId,
                                request.message(), mode, identity, decision.route(), hints, correction.prompt());
                            return engine.execute(initial, request.userId())
                                .flatMap(result -> deliver(request, decision, correction, result, startedAt));
                        }));
            })
            .onErrorResume(e -> {
                long elapsed = System.currentTimeMillis() - startedAt;
                log.error("[Turn] Processing failed. sessionId={} turnId={} timeMs={} reason={}",
                          request.sessionId(), turnId, elapsed, e.getMessage());
                return Mono.just(TurnResponse.failure(turnId, FAILURE_TEXT, elapsed));
            });

        return TraceContextUtil.withTrace(flow, turnId, request.sessionId());
    }

    /** {@code status}, then the full {@code content}, then {@code done} with metrics. */
    public Flux<TurnStreamEvent> streamTurn(TurnRequest request) {
        return Flux.concat(
            Mono.just(TurnStreamEvent.status(TurnStreamEvent.PREPARING)),
            processTurn(request).flatMapMany(response ->
                Flux.just(TurnStreamEvent.content(response.content()), TurnStreamEvent.done(response))));
    }

    public Mono<AgentView> sessionView(String sessionId) {
        return eventLog.snapshot(sessionId);
    }

    public Flux<AgentTurnRecord> recentTurns(String sessionId, int limit) {
        return turnLog.recent(sessionId, limit);
    }

    // ── delivery ────────────────────────────────────────────────────────────

    private Mono<TurnResponse> deliver(TurnRequest request, RouterDecision decision, CorrectionPrompt correction,
                                       TurnResult result, long startedAt) {
        PipelineState state = result.state();
        String output = result.output();
        boolean reviewable = output != null
            && !GeneratorNode.isErrorDraft(output)
            && !TurnPipelineEngine.NODE_FAILURE_TEXT.equals(output);
        String content;
        if (output == null) {
            content = NO_OUTPUT_TEXT;
        } else if (GeneratorNode.isErrorDraft(output)) {
            log.warn("[Turn] Error draft replaced by fallback text. turnId={}", state.turnId());
            content = TurnPipelineEngine.NODE_FAILURE_TEXT;
        } else {
            content = output;
        }

        long executionTimeMs = System.currentTimeMillis() - startedAt;
        TurnMetrics metrics = TurnMetrics.of(result.inputTokens(), result.outputTokens(), result.cacheTokens(),
            result.llmCalls().size(), result.estimatedCost(), executionTimeMs,
            result.nodesExecuted().stream().map(n -> n.name().toLowerCase()).toList());

        if (reviewable) {
            enqueueCritique(state, request.userId(), content);
        }

        flowLogger.logWithTraceId(TurnFlowLogger.DELIVERED, state.turnId());
        log.info("[Turn] Processing completed. sessionId={} turnId={} success={} approved={} attempts={} "
                 + "route={} timeMs={} outputLength={}", state.sessionId(), state.turnId(), result.success(),
                 result.approved(), state.attempts(), decision.route().wire(), executionTimeMs, content.length());

        TurnResponse response = new TurnResponse(state.turnId(), content, result.success(), state.attempts(),
            result.approved(), executionTimeMs, decision.route().wire(), decision,
            state.critiqueIssues().isEmpty() ? null : state.critiqueIssues(), metrics);

        return turnLog.record(result, request.userId(), content)
            .then(consumeCorrections(correction.correctionIds(), state.turnId()))
            .thenReturn(response);
    }

    private void enqueueCritique(PipelineState state, String userId, String delivered) {
        critiqueQueue.enqueue(CritiqueJob.fromTurn(state, userId, delivered))
            .subscribe(
                queued -> {
                    if (queued) flowLogger.logWithTraceId(TurnFlowLogger.CRITIQUE_ENQUEUED, state.turnId());
                },
                err -> log.warn("[Turn] Critique enqueue failed (non-critical). turnId={} reason={}",
                                state.turnId(), err.getMessage()));
    }

    private Mono<Void> consumeCorrections(List<Long> ids, String turnId) {
        return correctionService.markCorrectionsProcessed(ids)
            .then()
            .onErrorResume(e -> {
                log.warn("[Turn] Failed to mark corrections processed. turnId={} reason={}", turnId, e.getMessage());
                return Mono.empty();
            });
    }

    /** An explicit switch phrase in the message overrides the requested mode. */
    static AgentMode resolveMode(TurnRequest request, IdentityProfile identity) {
        AgentMode requested = AgentMode.fromWire(request.mode());
        AgentMode switched = ModeSwitchDetector.detect(identity, request.message());
        if (switched != null && switched != requested) {
            log.info("[Turn] Mode switch detected. from={} to={}", requested.wire(), switched.wire());
            return switched;
        }
        return requested;
    }
}
