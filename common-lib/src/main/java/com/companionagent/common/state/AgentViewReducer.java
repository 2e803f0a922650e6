package com.companionagent.common.state;

import com.companionagent.common.model.AgentView;
import com.companionagent.common.model.StateEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pure fold of a session's event log into an {@link AgentView}.
 *
 * <p>Events are applied in {@code sequence} order regardless of the order they are passed in,
 * so replaying the same log always produces the same view. A blank payload on a
 * topic, mood, task or goal event clears that field.
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class AgentViewReducer {

    private AgentViewReducer() {}

    public static AgentView replay(List<StateEvent> events) {
        if (events == null || events.isEmpty()) return AgentView.empty();

        List<StateEvent> ordered = new ArrayList<>(events);
        ordered.sort(Comparator.comparingLong(StateEvent::sequence));

        AgentView view = AgentView.empty();
        for (StateEvent event : ordered) {
            view = apply(view, event);
        }
        return view;
    }

    public static AgentView apply(AgentView view, StateEvent event) {
        String value = blankToNull(event.payload());
        return switch (event.type()) {
            case INTERACTION -> view.withInteraction();
            case TOPIC_SHIFT -> view.withTopic(value);
            case MOOD_CHANGE -> view.withMood(value);
            case TASK_UPDATE -> view.withTask(value);
            case USER_GOAL   -> view.withPlan(value);
        };
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
