package com.companionagent.common.model;

import com.companionagent.common.identity.IdentityProfile;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Working state of exactly one in-flight turn. Never shared across turns and never
 * mutated: every pipeline node returns a copy built with the {@code withX} factories.
 *
 * <p>{@code attempts} counts supervisor reviews plus failed repairs and only grows.
 */
public record PipelineState(
    @JsonProperty("session_id")        String          sessionId,
    @JsonProperty("turn_id")           String          turnId,
    @JsonProperty("user_input")        String          userInput,
    @JsonProperty("mode")              AgentMode       mode,
    @JsonProperty("identity")          IdentityProfile identity,
    @JsonProperty("route")             Route           route,
    @JsonProperty("agent_view")        AgentView       agentView,
    @JsonProperty("relevant_memories") List<String>    relevantMemories,
    @JsonProperty("plan")              String          plan,
    @JsonProperty("draft")             String          draft,
    @JsonProperty("critique_issues")   List<String>    critiqueIssues,
    @JsonProperty("attempts")          int             attempts,
    @JsonProperty("final_output")      String          finalOutput,
    @JsonProperty("started_at")        Instant         startedAt,
    @JsonProperty("injected_hints")    String          injectedHints,
    @JsonProperty("correction_prompt") String          correctionPrompt
) {
    public PipelineState {
        relevantMemories = relevantMemories == null ? List.of() : List.copyOf(relevantMemories);
        critiqueIssues   = critiqueIssues == null ? List.of() : List.copyOf(critiqueIssues);
        if (mode == null) mode = AgentMode.ASSISTANT;
        if (route == null) route = Route.PRO;
    }

    /** Fresh state for a new turn: no view, plan, draft or output yet. */
    public static PipelineState initial(String sessionId, String turnId, String userInput,
                                        AgentMode mode, IdentityProfile identity, Route route,
                                        String injectedHints, String correctionPrompt) {
        return new PipelineState(sessionId, turnId, userInput, mode, identity, route,
            null, List.of(), null, null, List.of(), 0, null, Instant.now(),
            injectedHints, correctionPrompt);
    }

    /**
     * Chooses the next step.
     * <ol>
     *   <li>final output set                 → {@link PipelineNode#END}</li>
     *   <li>no plan                          → {@link PipelineNode#PLAN}</li>
     *   <li>no draft                         → {@link PipelineNode#DRAFT}</li>
     *   <li>attempts ≥ {@code maxAttempts}   → {@link PipelineNode#FORCE_ACCEPT}</li>
     *   <li>open critique issues             → {@link PipelineNode#REPAIR}</li>
     *   <li>otherwise                        → {@link PipelineNode#CRITIQUE}</li>
     * </ol>
     */
    public PipelineNode nextNode(int maxAttempts) {
        if (finalOutput != null)            return PipelineNode.END;
        if (plan == null)                   return PipelineNode.PLAN;
        if (draft == null)                  return PipelineNode.DRAFT;
        if (attempts >= maxAttempts)        return PipelineNode.FORCE_ACCEPT;
        if (!critiqueIssues.isEmpty())      return PipelineNode.REPAIR;
        return PipelineNode.CRITIQUE;
    }

    @JsonIgnore
    public boolean isComplete() {
        return finalOutput != null;
    }

    // ── copy factories ─────────────────────────────────────────────────────

    public PipelineState withAgentView(AgentView view) {
        return new PipelineState(sessionId, turnId, userInput, mode, identity, route,
            view, relevantMemories, plan, draft, critiqueIssues, attempts, finalOutput,
            startedAt, injectedHints, correctionPrompt);
    }

    public PipelineState withRelevantMemories(List<String> memories) {
        return new PipelineState(sessionId, turnId, userInput, mode, identity, route,
            agentView, memories, plan, draft, critiqueIssues, attempts, finalOutput,
            startedAt, injectedHints, correctionPrompt);
    }

    public PipelineState withPlan(String newPlan) {
        return new PipelineState(sessionId, turnId, userInput, mode, identity, route,
            agentView, relevantMemories, newPlan, draft, critiqueIssues, attempts, finalOutput,
            startedAt, injectedHints, correctionPrompt);
    }

    public PipelineState withDraft(String newDraft) {
        return new PipelineState(sessionId, turnId, userInput, mode, identity, route,
            agentView, relevantMemories, plan, newDraft, critiqueIssues, attempts, finalOutput,
            startedAt, injectedHints, correctionPrompt);
    }

    /** Repaired draft: replaces the draft and clears the issues so the turn is reviewed again. */
    public PipelineState withRepairedDraft(String repaired) {
        return new PipelineState(sessionId, turnId, userInput, mode, identity, route,
            agentView, relevantMemories, plan, repaired, List.of(), attempts, finalOutput,
            startedAt, injectedHints, correctionPrompt);
    }

    /** Counts one more attempt without touching the draft or the issues. */
    public PipelineState withAttemptConsumed() {
        return new PipelineState(sessionId, turnId, userInput, mode, identity, route,
            agentView, relevantMemories, plan, draft, critiqueIssues, attempts + 1, finalOutput,
            startedAt, injectedHints, correctionPrompt);
    }

    /** Approved review: the current draft becomes the output. */
    public PipelineState approved() {
        return new PipelineState(sessionId, turnId, userInput, mode, identity, route,
            agentView, relevantMemories, plan, draft, List.of(), attempts + 1, draft,
            startedAt, injectedHints, correctionPrompt);
    }

    /** Rejected review: issues recorded for the repair step. */
    public PipelineState rejected(List<String> issues) {
        return new PipelineState(sessionId, turnId, userInput, mode, identity, route,
            agentView, relevantMemories, plan, draft, issues, attempts + 1, finalOutput,
            startedAt, injectedHints, correctionPrompt);
    }

    public PipelineState withFinalOutput(String output) {
        return new PipelineState(sessionId, turnId, userInput, mode, identity, route,
            agentView, relevantMemories, plan, draft, critiqueIssues, attempts, output,
            startedAt, injectedHints, correctionPrompt);
    }
}
