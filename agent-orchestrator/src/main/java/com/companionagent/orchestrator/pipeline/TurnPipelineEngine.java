package com.companionagent.orchestrator.pipeline;

import com.companionagent.common.model.PipelineNode;
import com.companionagent.common.model.PipelineState;
import com.companionagent.orchestrator.logger.TurnFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one turn through the node graph:
 * <pre>
 *   state manager → plan → draft → critique ⇄ repair → end
 * </pre>
 * The next node is always {@link PipelineState#nextNode(int)}; this class only executes it,
 * tracks every completed model call and contains failures. Termination is guaranteed by {@code attempts},
 * which every review increments: once it reaches {@code pipeline.max-attempts} the current
 * draft is accepted as is.
 */
@Component
public class TurnPipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(TurnPipelineEngine.class);

    public static final String NODE_FAILURE_TEXT =
        "I'm sorry, I encountered an issue processing your request. Could you please try again?";

    private final StateManagerNode stateManager;
    private final PlannerNode planner;
    private final GeneratorNode generator;
    private final SupervisorNode supervisor;
    private final TurnFlowLogger flowLogger;

    @Value("${pipeline.max-attempts:3}")
    private int maxAttempts = 3;

    @Value("${pipeline.turn-timeout-ms:60000}")
    private long turnTimeoutMs = 60_000;

    public TurnPipelineEngine(StateManagerNode stateManager, PlannerNode planner, GeneratorNode generator,
                              SupervisorNode supervisor, TurnFlowLogger flowLogger) {
        this.stateManager = stateManager;
        this.planner      = planner;
        this.generator    = generator;
        this.supervisor   = supervisor;
        this.flowLogger   = flowLogger;
    }

    /** Accumulated run state; replaced after every node. */
    private record Progress(PipelineState state, List<PipelineNode> nodes, List<LlmCall> calls,
                            int inputTokens, int outputTokens, boolean approved) {

        static Progress start(PipelineState state) {
            return new Progress(state, List.of(), List.of(), 0, 0, false);
        }

        Progress after(PipelineNode node, NodeResult result, boolean approvedNow, long durationMs) {
            List<PipelineNode> executed = new ArrayList<>(nodes);
            executed.add(node);
            List<LlmCall> tracked = calls;
            if (result.usage() != null) {
                tracked = new ArrayList<>(calls);
                tracked.add(new LlmCall(node, calls.size() + 1, result.usage(), durationMs));
            }
            return new Progress(result.state(), executed, tracked,
                inputTokens + result.inputTokens(), outputTokens + result.outputTokens(), approvedNow);
        }

        Progress withState(PipelineState next) {
            return new Progress(next, nodes, calls, inputTokens, outputTokens, approved);
        }
    }

    public Mono<TurnResult> execute(PipelineState initial, String userId) {
        return Mono.defer(() -> {
            long startedAt = System.currentTimeMillis();
            AtomicReference<Progress> latest = new AtomicReference<>(Progress.start(initial));

            log.info("[Pipeline] Turn started. sessionId={} turnId={} mode={} route={}",
                     initial.sessionId(), initial.turnId(), initial.mode().wire(), initial.route().wire());

            return stateManager.advance(initial, userId)
                .doOnNext(state -> flowLogger.logNode(TurnFlowLogger.STATE_ADVANCED, state))
                .onErrorResume(e -> {
                    log.error("[Pipeline] State manager failed, continuing without view or memories. "
                              + "sessionId={} turnId={} reason={}", initial.sessionId(), initial.turnId(), e.getMessage());
                    return Mono.just(initial);
                })
                .map(state -> {
                    Progress p = latest.get().withState(state);
                    latest.set(p);
                    return p;
                })
                .flatMap(p -> step(p, latest))
                .timeout(Duration.ofMillis(turnTimeoutMs))
                .map(p -> toResult(p, startedAt, false))
                .onErrorResume(TimeoutException.class, e -> {
                    Progress p = latest.get();
                    PipelineState s = p.state();
                    String output = s.draft() != null ? s.draft() : NODE_FAILURE_TEXT;
                    log.warn("[Pipeline] Turn timed out, accepting current draft. timeoutMs={} hasDraft={} turnId={}",
                             turnTimeoutMs, s.draft() != null, s.turnId());
                    flowLogger.logNode(TurnFlowLogger.FORCE_ACCEPTED, s);
                    return Mono.just(toResult(p.withState(s.withFinalOutput(output)), startedAt, true));
                })
                .doOnNext(r -> log.info("[Pipeline] Turn completed. sessionId={} turnId={} success={} approved={} "
                                        + "attempts={} nodes={} llmCalls={} tokensIn={} tokensOut={} cost={} durationMs={}",
                    r.state().sessionId(), r.state().turnId(), r.success(), r.approved(), r.state().attempts(),
                    r.nodesExecuted().size(), r.llmCalls().size(), r.inputTokens(), r.outputTokens(),
                    String.format("%.6f", r.estimatedCost()), r.totalDurationMs()));
        });
    }

    // ── loop ────────────────────────────────────────────────────────────────

    private Mono<Progress> step(Progress progress, AtomicReference<Progress> latest) {
        PipelineState state = progress.state();
        PipelineNode next = state.nextNode(maxAttempts);

        if (next == PipelineNode.END) {
            return Mono.just(progress);
        }
        if (next == PipelineNode.FORCE_ACCEPT) {
            log.warn("[Pipeline] Max attempts reached, accepting draft. attempts={} openIssues={} turnId={}",
                     state.attempts(), state.critiqueIssues(), state.turnId());
            PipelineState accepted = state.withFinalOutput(state.draft());
            flowLogger.logNode(TurnFlowLogger.FORCE_ACCEPTED, accepted);
            return Mono.just(progress.withState(accepted));
        }

        return runNode(next, progress)
            .onErrorResume(e -> {
                PipelineState contained = contain(next, state, e);
                return Mono.just(progress.withState(contained));
            })
            .doOnNext(latest::set)
            .flatMap(p -> step(p, latest));
    }

    private Mono<Progress> runNode(PipelineNode node, Progress progress) {
        return Mono.<Progress>defer(() -> {
            PipelineState state = progress.state();
            long startedAt = System.currentTimeMillis();
            return switch (node) {
                case PLAN -> planner.plan(state)
                    .map(r -> progress.after(node, r, false, System.currentTimeMillis() - startedAt))
                    .doOnNext(p -> flowLogger.logNode(TurnFlowLogger.PLANNED, p.state()));
                case DRAFT -> generator.draft(state)
                    .map(r -> progress.after(node, r, false, System.currentTimeMillis() - startedAt))
                    .doOnNext(p -> flowLogger.logNode(TurnFlowLogger.DRAFTED, p.state()));
                case CRITIQUE -> supervisor.review(state)
                    .map(s -> progress.after(node, s.toNodeResult(), s.verdict().approved(),
                                             System.currentTimeMillis() - startedAt))
                    .doOnNext(p -> flowLogger.logNode(TurnFlowLogger.SUPERVISED, p.state()));
                case REPAIR -> generator.repair(state)
                    .map(r -> progress.after(node, r, false, System.currentTimeMillis() - startedAt))
                    .doOnNext(p -> flowLogger.logNode(TurnFlowLogger.REPAIRED, p.state()));
                default -> Mono.<Progress>error(new IllegalStateException("Not an executable node: " + node));
            };
        });
    }

    /**
     * Plan or draft failures end the turn with {@link #NODE_FAILURE_TEXT}; critique or repair
     * failures deliver the current draft.
     */
    private static PipelineState contain(PipelineNode node, PipelineState state, Throwable e) {
        log.error("[Pipeline] Node failed. node={} sessionId={} turnId={} reason={}",
                  node, state.sessionId(), state.turnId(), e.getMessage());
        if (node == PipelineNode.PLAN || node == PipelineNode.DRAFT || state.draft() == null) {
            return state.withFinalOutput(NODE_FAILURE_TEXT);
        }
        return state.withFinalOutput(state.draft());
    }

    private static TurnResult toResult(Progress p, long startedAt, boolean timedOut) {
        return new TurnResult(p.state(), p.state().finalOutput(), p.approved(), p.nodes(), p.calls(),
            p.inputTokens(), p.outputTokens(), System.currentTimeMillis() - startedAt, timedOut);
    }
}
