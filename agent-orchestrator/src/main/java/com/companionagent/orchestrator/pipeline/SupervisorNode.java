package com.companionagent.orchestrator.pipeline;

import com.companionagent.common.identity.IdentityPromptRenderer;
import com.companionagent.common.model.PipelineState;
import com.companionagent.common.model.SupervisorVerdict;
import com.companionagent.common.supervisor.QuickComplianceChecks;
import com.companionagent.orchestrator.completion.CompletionProviders;
import com.companionagent.orchestrator.completion.CompletionResult;
import com.companionagent.orchestrator.completion.CompletionTask;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Reviews the current draft. Quick rule checks run first and, when any fails, decide the
 * verdict without a model call. Otherwise a low-cost judge model is asked for a JSON verdict.
 *
 * <p>Every review counts one attempt, approved or not. Unreadable verdicts, judge failures
 * and judge calls exceeding {@code supervisor.judge-timeout-ms} resolve to the fail-open
 * verdict when {@code supervisor.fail-open} is true.
 */
@Component
public class SupervisorNode {

    private static final Logger log = LoggerFactory.getLogger(SupervisorNode.class);

    /** State after the review, the verdict that produced it and the judge's token usage. */
    public record SupervisedState(PipelineState state, SupervisorVerdict verdict, CompletionResult usage) {

        public NodeResult toNodeResult() {
            return NodeResult.of(state, usage);
        }
    }

    static final String SUPERVISOR_SYSTEM_PROMPT = """
        You are a compliance checker for an AI assistant. Review responses for ACTUAL policy violations only.

        IMPORTANT CLARIFICATIONS:
        - "Using tools for smalltalk" means the response mentions calling APIs/tools for simple greetings. Normal text responses to informal requests are FINE.
        - "Overly verbose responses to greetings" only applies if a greeting response is 3+ paragraphs. Brief friendly responses are FINE.
        - A joke request is NOT smalltalk - it's a specific content request.
        - Most responses should be APPROVED. Only flag clear, obvious violations.

        Output ONLY valid JSON:
        {"approved": true/false, "issues": ["issue1", "issue2"], "fix_instructions": "how to fix"}

        Rules:
        - Default to approved: true unless there's a clear violation
        - If approved is true, issues should be empty array []
        - If approved is false, issues must list ONLY actual violations found
        - Output ONLY the JSON, no other text""";

    static final double JUDGE_TEMPERATURE = 0.1;
    static final int    JUDGE_MAX_TOKENS  = 500;

    static final String REVIEW_UNAVAILABLE_ISSUE =
        "Compliance review could not be completed; re-check the response against the behavioral rules";

    private final CompletionProviders completionProviders;
    private final ObjectMapper objectMapper;

    @Value("${supervisor.fail-open:true}")
    private boolean failOpen = true;

    @Value("${supervisor.judge-timeout-ms:15000}")
    private long judgeTimeoutMs = 15_000;

    public SupervisorNode(CompletionProviders completionProviders, ObjectMapper objectMapper) {
        this.completionProviders = completionProviders;
        this.objectMapper        = objectMapper;
    }

    public Mono<SupervisedState> review(PipelineState state) {
        SupervisorVerdict quick = QuickComplianceChecks.check(state.draft(), state.mode(), state.relevantMemories());
        if (quick != null) {
            log.info("[Supervisor] Quick check failed. issues={} mode={} turnId={}",
                     quick.issues(), state.mode().wire(), state.turnId());
            return Mono.just(new SupervisedState(apply(state, quick), quick, null));
        }

        return completionProviders.complete(CompletionTask.JUDGE, SUPERVISOR_SYSTEM_PROMPT,
                                            buildSupervisorPrompt(state), JUDGE_TEMPERATURE, JUDGE_MAX_TOKENS)
            .map(result -> {
                SupervisorVerdict verdict = readVerdict(result.content(), state);
                log.info("[Supervisor] verdict approved={} issues={} tokens={} turnId={}",
                         verdict.approved(), verdict.issues().size(), result.totalTokens(), state.turnId());
                return new SupervisedState(apply(state, verdict), verdict, result);
            })
            .timeout(Duration.ofMillis(judgeTimeoutMs))
            .onErrorResume(e -> {
                log.error("[Supervisor] Judge call failed. failOpen={} sessionId={} turnId={} reason={}",
                          failOpen, state.sessionId(), state.turnId(), e.getMessage());
                SupervisorVerdict verdict = fallbackVerdict();
                return Mono.just(new SupervisedState(apply(state, verdict), verdict, null));
            });
    }

    static String buildSupervisorPrompt(PipelineState state) {
        List<String> parts = new ArrayList<>();
        String norms = IdentityPromptRenderer.norms(state.identity());
        if (!norms.isEmpty()) {
            parts.add("[Behavioral Rules]\n" + norms);
        }
        parts.add("[Compliance Rubric]\n" + IdentityPromptRenderer.rubric(state.identity()));
        parts.add("[Original User Message]\n" + state.userInput());
        parts.add("[Draft Response to Review]\n" + (state.draft() != null ? state.draft() : "(no draft)"));
        parts.add("[Task]\nReview the draft response for compliance violations. Output JSON verdict.");
        return String.join("\n\n", parts);
    }

    // ── verdict handling ────────────────────────────────────────────────────

    private SupervisorVerdict readVerdict(String reply, PipelineState state) {
        try {
            return VerdictParser.parse(reply, objectMapper);
        } catch (RuntimeException e) {
            String head = reply == null ? "" : reply.substring(0, Math.min(200, reply.length()));
            log.warn("[Supervisor] Unreadable verdict. failOpen={} turnId={} reason={} response=\"{}\"",
                     failOpen, state.turnId(), e.getMessage(), head);
            return fallbackVerdict();
        }
    }

    private SupervisorVerdict fallbackVerdict() {
        return failOpen
            ? SupervisorVerdict.approve()
            : SupervisorVerdict.reject(List.of(REVIEW_UNAVAILABLE_ISSUE),
                                       QuickComplianceChecks.fixInstructions(List.of(REVIEW_UNAVAILABLE_ISSUE)));
    }

    private static PipelineState apply(PipelineState state, SupervisorVerdict verdict) {
        return verdict.approved() ? state.approved() : state.rejected(verdict.issues());
    }
}
