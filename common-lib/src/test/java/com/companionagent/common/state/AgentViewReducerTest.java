package com.companionagent.common.state;

import com.companionagent.common.model.AgentView;
import com.companionagent.common.model.StateEvent;
import com.companionagent.common.model.StateEventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentViewReducerTest {

    private static StateEvent event(long seq, StateEventType type, String payload) {
        return new StateEvent("s1", "t" + seq, type, payload, seq, Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("empty log → empty view")
    void emptyLog() {
        assertEquals(AgentView.empty(), AgentViewReducer.replay(List.of()));
        assertEquals(AgentView.empty(), AgentViewReducer.replay(null));
    }

    @Test
    @DisplayName("later events overwrite earlier ones; interactions accumulate")
    void fold() {
        AgentView view = AgentViewReducer.replay(List.of(
            event(1, StateEventType.INTERACTION, null),
            event(2, StateEventType.TOPIC_SHIFT, "gardening"),
            event(3, StateEventType.INTERACTION, null),
            event(4, StateEventType.TOPIC_SHIFT, "cooking"),
            event(5, StateEventType.MOOD_CHANGE, "happy"),
            event(6, StateEventType.TASK_UPDATE, "meal plan"),
            event(7, StateEventType.USER_GOAL, "eat healthier")));

        assertEquals(new AgentView("cooking", "happy", "meal plan", "eat healthier", 2), view);
    }

    @Test
    @DisplayName("blank task payload clears the active task")
    void clearTask() {
        AgentView view = AgentViewReducer.replay(List.of(
            event(1, StateEventType.TASK_UPDATE, "write report"),
            event(2, StateEventType.TASK_UPDATE, "")));
        assertNull(view.activeTask());
    }

    @Test
    @DisplayName("replay orders by sequence, not by input order")
    void orderIndependent() {
        List<StateEvent> ordered = List.of(
            event(1, StateEventType.TOPIC_SHIFT, "a"),
            event(2, StateEventType.TOPIC_SHIFT, "b"),
            event(3, StateEventType.INTERACTION, null));
        List<StateEvent> shuffled = new ArrayList<>(ordered);
        Collections.reverse(shuffled);

        AgentView expected = AgentViewReducer.replay(ordered);
        assertEquals(expected, AgentViewReducer.replay(shuffled));
        assertEquals("b", expected.currentTopic());
    }
}
