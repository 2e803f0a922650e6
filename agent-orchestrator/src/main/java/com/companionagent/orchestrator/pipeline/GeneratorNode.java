package com.companionagent.orchestrator.pipeline;

import com.companionagent.common.identity.IdentityProfile;
import com.companionagent.common.identity.IdentityPromptRenderer;
import com.companionagent.common.model.PipelineState;
import com.companionagent.common.state.AgentViewRenderer;
import com.companionagent.orchestrator.completion.CompletionProviders;
import com.companionagent.orchestrator.completion.CompletionTask;
import com.companionagent.orchestrator.completion.ModelSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Draft and repair steps of the pipeline.
 *
 * <p>Draft never leaves the state without a draft: a failed or empty completion becomes an
 * {@link #ERROR_MARKER} draft, which the supervisor reviews like any other and the delivery
 * layer later swaps for the safe fallback text. Repair never increments {@code attempts} on
 * success; only the supervisor does. A failed repair consumes one attempt so the loop still
 * terminates when the provider is down.
 */
@Component
public class GeneratorNode {

    private static final Logger log = LoggerFactory.getLogger(GeneratorNode.class);

    public static final String ERROR_MARKER = "[Error generating response:";

    static final double DRAFT_TEMPERATURE  = 0.7;
    static final double REPAIR_TEMPERATURE = 0.5;

    private final CompletionProviders completionProviders;

    public GeneratorNode(CompletionProviders completionProviders) {
        this.completionProviders = completionProviders;
    }

    public static boolean isErrorDraft(String draft) {
        return draft != null && draft.startsWith(ERROR_MARKER);
    }

    // ── draft ───────────────────────────────────────────────────────────────

    public Mono<NodeResult> draft(PipelineState state) {
        CompletionTask task = ModelSelector.draftTask(state.route());
        return completionProviders.complete(task, buildDraftSystemPrompt(state), buildDraftUserPrompt(state),
                                            DRAFT_TEMPERATURE, state.mode().draftMaxTokens())
            .map(result -> {
                String draft = result.content() == null ? "" : result.content().trim();
                if (draft.isEmpty()) {
                    log.warn("[Generator] Empty draft. task={} turnId={}", task, state.turnId());
                    return NodeResult.of(state.withDraft(errorDraft("empty completion")), result);
                }
                log.debug("[Generator] draft length={} tokens={} turnId={}",
                          draft.length(), result.totalTokens(), state.turnId());
                return NodeResult.of(state.withDraft(draft), result);
            })
            .onErrorResume(e -> {
                log.error("[Generator] Draft failed. task={} sessionId={} turnId={} reason={}",
                          task, state.sessionId(), state.turnId(), e.getMessage());
                return Mono.just(NodeResult.of(state.withDraft(errorDraft(e.getMessage()))));
            });
    }

    static String buildDraftSystemPrompt(PipelineState state) {
        IdentityProfile identity = state.identity();
        List<String> parts = new ArrayList<>();
        parts.add("You are " + identity.traits().name() + ", " + identity.traits().role() + ".");
        parts.add("Core traits: " + String.join(", ", identity.traits().personality()));
        addSection(parts, "[Shared Spine - Always Apply]", IdentityPromptRenderer.sharedSpine(identity));
        addSection(parts, "[Current Mode]", IdentityPromptRenderer.mode(identity, state.mode()));
        addSection(parts, "[Behavioral Rules]", IdentityPromptRenderer.norms(identity));
        addSection(parts, "[Style]", IdentityPromptRenderer.style(identity, state.mode()));
        addSection(parts, "[Guardrail]", IdentityPromptRenderer.guardrail(identity));
        addSection(parts, "[Capabilities]", IdentityPromptRenderer.capabilities(identity));
        if (state.injectedHints() != null && !state.injectedHints().isEmpty()) {
            parts.add("\n" + state.injectedHints());
        }
        return String.join("\n", parts);
    }

    static String buildDraftUserPrompt(PipelineState state) {
        List<String> parts = new ArrayList<>();
        parts.add(AgentViewRenderer.render(state.agentView()));
        if (!state.relevantMemories().isEmpty()) {
            parts.add("[Context]\n" + String.join("\n", state.relevantMemories()));
        }
        if (state.plan() != null) {
            parts.add("[Response Plan]\n" + state.plan());
        }
        if (state.correctionPrompt() != null && !state.correctionPrompt().isEmpty()) {
            parts.add(state.correctionPrompt());
        }
        parts.add("[User Message]\n" + state.userInput());
        parts.add("[Task]\nGenerate a response following the plan and behavioral rules.");
        return String.join("\n\n", parts);
    }

    // ── repair ──────────────────────────────────────────────────────────────

    public Mono<NodeResult> repair(PipelineState state) {
        return completionProviders.complete(CompletionTask.REPAIR, buildRepairSystemPrompt(state),
                                            buildRepairUserPrompt(state),
                                            REPAIR_TEMPERATURE, state.mode().draftMaxTokens())
            .map(result -> {
                String repaired = result.content() == null ? "" : result.content().trim();
                // blank reply: keep the old draft and let the supervisor look at it again
                String next = repaired.isEmpty() ? state.draft() : repaired;
                log.debug("[Generator] repair attempt={} issues={} length={} turnId={}",
                          state.attempts(), state.critiqueIssues().size(), next.length(), state.turnId());
                return NodeResult.of(state.withRepairedDraft(next), result);
            })
            .onErrorResume(e -> {
                log.error("[Generator] Repair failed, keeping draft. sessionId={} turnId={} attempt={} reason={}",
                          state.sessionId(), state.turnId(), state.attempts(), e.getMessage());
                return Mono.just(NodeResult.of(state.withAttemptConsumed()));
            });
    }

    static String buildRepairSystemPrompt(PipelineState state) {
        IdentityProfile identity = state.identity();
        List<String> parts = new ArrayList<>();
        parts.add("You are " + identity.traits().name() + ". You need to fix your previous response.");
        addSection(parts, "[CRITICAL - Follow These Rules]", IdentityPromptRenderer.norms(identity));
        addSection(parts, "[Style]", IdentityPromptRenderer.style(identity, state.mode()));
        return String.join("\n", parts);
    }

    static String buildRepairUserPrompt(PipelineState state) {
        List<String> parts = new ArrayList<>();
        if (state.plan() != null) {
            parts.add("[Response Plan]\n" + state.plan());
        }
        if (state.draft() != null) {
            parts.add("[Previous Response (has issues)]\n" + state.draft());
        }
        if (!state.critiqueIssues().isEmpty()) {
            parts.add("[Issues to Fix]\n" + state.critiqueIssues().stream()
                .map(issue -> "- " + issue)
                .collect(Collectors.joining("\n")));
        }
        parts.add("[Original User Message]\n" + state.userInput());
        parts.add("[Task]\nRewrite the response to fix ALL the issues listed above. Output only the corrected response.");
        return String.join("\n\n", parts);
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    private static void addSection(List<String> parts, String header, String body) {
        if (body != null && !body.isEmpty()) {
            parts.add("\n" + header + "\n" + body);
        }
    }

    private static String errorDraft(String reason) {
        return ERROR_MARKER + " " + reason + "]";
    }
}
