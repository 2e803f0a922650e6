package com.companionagent.orchestrator.pipeline;

import com.companionagent.common.identity.IdentityProfile;
import com.companionagent.common.identity.IdentityPromptRenderer;
import com.companionagent.common.model.PipelineState;
import com.companionagent.common.state.AgentViewRenderer;
import com.companionagent.orchestrator.completion.CompletionProviders;
import com.companionagent.orchestrator.completion.CompletionTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Writes the short response plan the generator follows.
 *
 * <p>The plan is 1 to 6 plain lines. In casual modes a smalltalk message asks the model for
 * a single natural step and keeps only the first line of whatever comes back. Provider failures and empty replies fall back to the
 * mode's static plan, so this node always sets a plan.
 */
@Component
public class PlannerNode {

    private static final Logger log = LoggerFactory.getLogger(PlannerNode.class);

    static final int MAX_PLAN_LINES = 6;

    private static final double TEMPERATURE = 0.3;
    private static final int    MAX_TOKENS  = 300;

    private static final Pattern LIST_MARKER = Pattern.compile("^\\s*(?:\\d+[.)]|[-*•])\\s*");

    private static final Pattern SMALLTALK = Pattern.compile(
        "^(?:hi+|hey+|hello|yo|sup|hiya|howdy|good (?:morning|afternoon|evening|night)"
        + "|thanks?|thank you|thx|ty|bye|goodbye|see you|cya|lol|haha+|ok(?:ay)?|cool|nice"
        + "|how are you|how's it going|what's up|whats up)\\b.*",
        Pattern.CASE_INSENSITIVE);

    private static final int SMALLTALK_MAX_LENGTH = 40;

    static final String SMALLTALK_DIRECTIVE =
        "Write a plan with exactly one step: respond naturally and briefly, the way a friend would. "
        + "Output only that step.";

    static final String FULL_DIRECTIVE =
        "Write a plan of 1 to 6 short steps for the response, one step per line. "
        + "Use fewer steps for simple messages and more for complex ones. "
        + "Do not write the response itself. Output only the steps.";

    private final CompletionProviders completionProviders;

    public PlannerNode(CompletionProviders completionProviders) {
        this.completionProviders = completionProviders;
    }

    public Mono<NodeResult> plan(PipelineState state) {
        boolean smalltalk = state.mode().isCasual() && isSmalltalk(state.userInput(), state.identity());
        String system = buildSystemPrompt(state);
        String user   = buildUserPrompt(state, smalltalk);

        return completionProviders.complete(CompletionTask.PLANNER, system, user, TEMPERATURE, MAX_TOKENS)
            .map(result -> {
                String plan = normalise(result.content());
                if (smalltalk) plan = firstLine(plan);
                if (plan.isEmpty()) {
                    log.warn("[Planner] Empty plan, using fallback. mode={} turnId={}",
                             state.mode().wire(), state.turnId());
                    return NodeResult.of(state.withPlan(state.mode().fallbackPlan()), result);
                }
                log.debug("[Planner] plan lines={} smalltalk={} turnId={}",
                          plan.split("\n").length, smalltalk, state.turnId());
                return NodeResult.of(state.withPlan(plan), result);
            })
            .onErrorResume(e -> {
                log.warn("[Planner] Planning failed, using fallback. mode={} turnId={} reason={}",
                         state.mode().wire(), state.turnId(), e.getMessage());
                return Mono.just(NodeResult.of(state.withPlan(state.mode().fallbackPlan())));
            });
    }

    // ── prompt ──────────────────────────────────────────────────────────────

    static String buildSystemPrompt(PipelineState state) {
        IdentityProfile identity = state.identity();
        List<String> parts = new ArrayList<>();
        parts.add("[Mode: " + state.mode().wire() + "]");
        addSection(parts, "[Shared Spine - Always Apply]", IdentityPromptRenderer.sharedSpine(identity));
        parts.add("You plan responses for " + identity.traits().name() + ", " + identity.traits().role() + ". "
                  + "You write the plan only, never the response.");
        addSection(parts, "[Current Mode]", IdentityPromptRenderer.mode(identity, state.mode()));
        addSection(parts, "[Behavioral Rules]", IdentityPromptRenderer.norms(identity));
        addSection(parts, "[Style]", IdentityPromptRenderer.style(identity, state.mode()));
        return String.join("\n\n", parts);
    }

    static String buildUserPrompt(PipelineState state, boolean smalltalk) {
        List<String> parts = new ArrayList<>();
        parts.add(AgentViewRenderer.render(state.agentView()));
        if (!state.relevantMemories().isEmpty()) {
            parts.add("[Context]\n" + String.join("\n", state.relevantMemories()));
        }
        parts.add("[User Message]\n" + state.userInput());
        parts.add("[Task]\n" + (smalltalk ? SMALLTALK_DIRECTIVE : FULL_DIRECTIVE));
        return String.join("\n\n", parts);
    }

    private static void addSection(List<String> parts, String header, String body) {
        if (body != null && !body.isEmpty()) {
            parts.add(header + "\n" + body);
        }
    }

    // ── smalltalk / normalisation ───────────────────────────────────────────

    /**
     * Short greeting, thanks or farewell, or a message matching one of the identity's
     * configured smalltalk triggers.
     */
    static boolean isSmalltalk(String message, IdentityProfile identity) {
        if (message == null) return false;
        String text = message.trim().toLowerCase();
        if (text.isEmpty() || text.length() > SMALLTALK_MAX_LENGTH) return false;
        if (SMALLTALK.matcher(text).matches()) return true;

        if (identity != null && identity.toolGating() != null && identity.toolGating().smalltalkTriggers() != null) {
            return identity.toolGating().smalltalkTriggers().stream()
                .map(String::toLowerCase)
                .anyMatch(trigger -> text.equals(trigger) || text.startsWith(trigger + " "));
        }
        return false;
    }

    static String firstLine(String plan) {
        int end = plan.indexOf('\n');
        return end < 0 ? plan : plan.substring(0, end);
    }

    /** Strips numbering and bullets, drops blank lines, keeps at most {@link #MAX_PLAN_LINES}. */
    static String normalise(String reply) {
        if (reply == null) return "";
        return Arrays.stream(reply.split("\\r?\\n"))
            .map(line -> LIST_MARKER.matcher(line).replaceFirst("").trim())
            .filter(line -> !line.isEmpty())
            .limit(MAX_PLAN_LINES)
            .collect(Collectors.joining("\n"));
    }
}
