package com.companionagent.common.state;

import com.companionagent.common.model.AgentView;

/** Renders an {@link AgentView} as a prompt block. Unset fields are omitted. */
public final class AgentViewRenderer {

    private AgentViewRenderer() {}

    public static String render(AgentView view) {
        AgentView v = view == null ? AgentView.empty() : view;
        StringBuilder sb = new StringBuilder("[Current State]");
        if (v.currentTopic() != null) sb.append("\nTopic: ").append(v.currentTopic());
        if (v.currentMood() != null)  sb.append("\nUser mood: ").append(v.currentMood());
        if (v.activeTask() != null)   sb.append("\nActive task: ").append(v.activeTask());
        if (v.activePlan() != null)   sb.append("\nUser goal: ").append(v.activePlan());
        sb.append("\nInteractions this session: ").append(v.interactionCount());
        return sb.toString();
    }
}
