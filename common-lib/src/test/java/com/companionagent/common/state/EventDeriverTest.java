package com.companionagent.common.state;

import com.companionagent.common.model.AgentView;
import com.companionagent.common.model.StateEvent;
import com.companionagent.common.model.StateEventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventDeriverTest {

    private static List<StateEventType> types(List<StateEvent> events) {
        return events.stream().map(StateEvent::type).toList();
    }

    @Test
    @DisplayName("plain message yields a single interaction")
    void interactionOnly() {
        List<StateEvent> events = EventDeriver.derive("s1", "t1", "hey", AgentView.empty());
        assertEquals(List.of(StateEventType.INTERACTION), types(events));
        assertEquals("t1", events.get(0).turnId());
    }

    @Test
    @DisplayName("mood and task cues are extracted")
    void moodAndTask() {
        List<StateEvent> events = EventDeriver.derive("s1", "t1",
            "I'm so stressed, help me with my thesis.", AgentView.empty());

        assertEquals(List.of(StateEventType.INTERACTION, StateEventType.MOOD_CHANGE, StateEventType.TASK_UPDATE),
            types(events));
        assertEquals("stressed", events.get(1).payload());
        assertEquals("my thesis", events.get(2).payload());
    }

    @Test
    @DisplayName("values already in the view are not re-emitted")
    void unchangedValuesSkipped() {
        AgentView view = new AgentView("jazz", "stressed", null, null, 4);
        List<StateEvent> events = EventDeriver.derive("s1", "t2",
            "let's talk about jazz, I'm stressed", view);
        assertEquals(List.of(StateEventType.INTERACTION), types(events));
    }

    @Test
    @DisplayName("topic shift and user goal")
    void topicAndGoal() {
        List<StateEvent> events = EventDeriver.derive("s1", "t1",
            "Let's talk about marathons. My goal is to run one next spring", AgentView.empty());
        assertTrue(types(events).contains(StateEventType.TOPIC_SHIFT));
        assertTrue(types(events).contains(StateEventType.USER_GOAL));
        assertEquals("marathons", events.stream()
            .filter(e -> e.type() == StateEventType.TOPIC_SHIFT).findFirst().orElseThrow().payload());
        assertEquals("run one next spring", events.stream()
            .filter(e -> e.type() == StateEventType.USER_GOAL).findFirst().orElseThrow().payload());
    }

    @Test
    @DisplayName("finishing a task clears it only when one is active")
    void taskDone() {
        AgentView withTask = new AgentView(null, null, "tax return", null, 2);
        List<StateEvent> events = EventDeriver.derive("s1", "t3", "ok I'm done with that", withTask);
        StateEvent clear = events.stream()
            .filter(e -> e.type() == StateEventType.TASK_UPDATE).findFirst().orElseThrow();
        assertEquals("", clear.payload());

        assertEquals(List.of(StateEventType.INTERACTION),
            types(EventDeriver.derive("s1", "t3", "ok I'm done with that", AgentView.empty())));
    }

    @Test
    @DisplayName("derived then replayed events update the view")
    void deriveThenReplay() {
        List<StateEvent> events = EventDeriver.derive("s1", "t1", "I need to renew my passport", AgentView.empty());
        List<StateEvent> sequenced = new java.util.ArrayList<>();
        for (int i = 0; i < events.size(); i++) sequenced.add(events.get(i).atSequence(i + 1));

        AgentView view = AgentViewReducer.replay(sequenced);
        assertEquals("renew my passport", view.activeTask());
        assertEquals(1, view.interactionCount());
    }
}
