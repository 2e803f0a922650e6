package com.companionagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-session conversational snapshot. Always derived by folding the session's
 * {@link StateEvent} log; never persisted as a source of truth.
 */
public record AgentView(
    @JsonProperty("current_topic")     String currentTopic,
    @JsonProperty("current_mood")      String currentMood,
    @JsonProperty("active_task")       String activeTask,
    @JsonProperty("active_plan")       String activePlan,
    @JsonProperty("interaction_count") int    interactionCount
) {
    public static AgentView empty() {
        return new AgentView(null, null, null, null, 0);
    }

    public AgentView withTopic(String topic) {
        return new AgentView(topic, currentMood, activeTask, activePlan, interactionCount);
    }

    public AgentView withMood(String mood) {
        return new AgentView(currentTopic, mood, activeTask, activePlan, interactionCount);
    }

    public AgentView withTask(String task) {
        return new AgentView(currentTopic, currentMood, task, activePlan, interactionCount);
    }

    public AgentView withPlan(String plan) {
        return new AgentView(currentTopic, currentMood, activeTask, plan, interactionCount);
    }

    public AgentView withInteraction() {
        return new AgentView(currentTopic, currentMood, activeTask, activePlan, interactionCount + 1);
    }
}
