package com.companionagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of a delivered turn, queued for asynchronous re-review.
 * {@code identityVersion} is the version pinned when the turn ran, so the review
 * applies the rules that were actually in force.
 */
public record CritiqueJob(
    @JsonProperty("turn_id")          String    turnId,
    @JsonProperty("session_id")       String    sessionId,
    @JsonProperty("user_id")          String    userId,
    @JsonProperty("user_input")       String    userInput,
    @JsonProperty("draft")            String    draft,
    @JsonProperty("plan")             String    plan,
    @JsonProperty("mode")             AgentMode mode,
    @JsonProperty("identity_id")      String    identityId,
    @JsonProperty("identity_version") int       identityVersion
) {
    public static CritiqueJob fromTurn(PipelineState state, String userId, String delivered) {
        return new CritiqueJob(state.turnId(), state.sessionId(), userId, state.userInput(),
            delivered, state.plan(), state.mode(),
            state.identity().id(), state.identity().version());
    }
}
