package com.companionagent.common.state;

import com.companionagent.common.model.AgentView;
import com.companionagent.common.model.StateEvent;
import com.companionagent.common.model.StateEventType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the events one user message adds to a session log, relative to the current view.
 *
 * <p>Every message yields an {@code interaction}. Topic, mood, task and goal events are
 * emitted only when a cue is detected and the extracted value differs from the view.
 * Events are returned without sequence numbers; the store assigns them on append.
 */
public final class EventDeriver {

    static final int MAX_VALUE_LENGTH = 80;

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<Pattern> TOPIC_CUES = List.of(
        Pattern.compile("\\blet'?s\\s+(?:talk|chat)\\s+about\\s+(.+)", FLAGS),
        Pattern.compile("\\b(?:can|could)\\s+we\\s+(?:talk|chat)\\s+about\\s+(.+)", FLAGS),
        Pattern.compile("\\bchanging\\s+the\\s+subject,?\\s+(.+)", FLAGS),
        Pattern.compile("^what\\s+about\\s+(.+)", FLAGS),
        Pattern.compile("\\btell\\s+me\\s+about\\s+(.+)", FLAGS)
    );

    private static final List<Pattern> TASK_CUES = List.of(
        Pattern.compile("\\bhelp\\s+me\\s+(?:with\\s+|to\\s+)?(.+)", FLAGS),
        Pattern.compile("\\bi\\s+need\\s+to\\s+(.+)", FLAGS),
        Pattern.compile("\\bi'?m\\s+working\\s+on\\s+(.+)", FLAGS),
        Pattern.compile("\\bi\\s+am\\s+working\\s+on\\s+(.+)", FLAGS)
    );

    private static final Pattern TASK_DONE = Pattern.compile(
        "\\b(?:i'?m\\s+done|i\\s+am\\s+done|finished\\s+(?:it|that|the\\s+task)|task\\s+(?:is\\s+)?(?:done|complete|completed))\\b",
        FLAGS);

    private static final List<Pattern> GOAL_CUES = List.of(
        Pattern.compile("\\bmy\\s+goal\\s+is\\s+(?:to\\s+)?(.+)", FLAGS),
        Pattern.compile("\\bi\\s+want\\s+to\\s+(.+)", FLAGS),
        Pattern.compile("\\bi'?m\\s+trying\\s+to\\s+(.+)", FLAGS),
        Pattern.compile("\\bi\\s+plan\\s+to\\s+(.+)", FLAGS)
    );

    /** Mood label per cue, checked in insertion order. */
    private static final Map<String, Pattern> MOOD_CUES = new LinkedHashMap<>();

    static {
        MOOD_CUES.put("stressed",   Pattern.compile("\\b(stressed|anxious|worried|overwhelmed|nervous)\\b", FLAGS));
        MOOD_CUES.put("frustrated", Pattern.compile("\\b(frustrated|annoyed|angry|mad|pissed)\\b", FLAGS));
        MOOD_CUES.put("sad",        Pattern.compile("\\b(sad|down|depressed|lonely|upset|miserable)\\b", FLAGS));
        MOOD_CUES.put("tired",      Pattern.compile("\\b(tired|exhausted|sleepy|drained|burned\\s+out)\\b", FLAGS));
        MOOD_CUES.put("happy",      Pattern.compile("\\b(happy|excited|great|thrilled|awesome|glad)\\b", FLAGS));
    }

    private EventDeriver() {}

    public static List<StateEvent> derive(String sessionId, String turnId, String userInput, AgentView view) {
        AgentView current = view == null ? AgentView.empty() : view;
        String text = userInput == null ? "" : userInput.trim();

        List<StateEvent> events = new ArrayList<>();
        events.add(StateEvent.pending(sessionId, turnId, StateEventType.INTERACTION, null));

        String topic = firstCapture(TOPIC_CUES, text);
        if (topic != null && !sameValue(topic, current.currentTopic())) {
            events.add(StateEvent.pending(sessionId, turnId, StateEventType.TOPIC_SHIFT, topic));
        }

        String mood = detectMood(text);
        if (mood != null && !sameValue(mood, current.currentMood())) {
            events.add(StateEvent.pending(sessionId, turnId, StateEventType.MOOD_CHANGE, mood));
        }

        if (TASK_DONE.matcher(text).find()) {
            if (current.activeTask() != null) {
                events.add(StateEvent.pending(sessionId, turnId, StateEventType.TASK_UPDATE, ""));
            }
        } else {
            String task = firstCapture(TASK_CUES, text);
            if (task != null && !sameValue(task, current.activeTask())) {
                events.add(StateEvent.pending(sessionId, turnId, StateEventType.TASK_UPDATE, task));
            }
        }

        String goal = firstCapture(GOAL_CUES, text);
        if (goal != null && !sameValue(goal, current.activePlan())) {
            events.add(StateEvent.pending(sessionId, turnId, StateEventType.USER_GOAL, goal));
        }
        return List.copyOf(events);
    }

    static String detectMood(String text) {
        for (Map.Entry<String, Pattern> e : MOOD_CUES.entrySet()) {
            if (e.getValue().matcher(text).find()) return e.getKey();
        }
        return null;
    }

    static String firstCapture(List<Pattern> cues, String text) {
        for (Pattern cue : cues) {
            Matcher m = cue.matcher(text);
            if (m.find()) {
                String value = clean(m.group(1));
                if (!value.isEmpty()) return value;
            }
        }
        return null;
    }

    /** Cuts at the first clause break and bounds the length. */
    static String clean(String raw) {
        String s = raw.split("[.!?,;:\\n]", 2)[0].trim();
        return s.length() > MAX_VALUE_LENGTH ? s.substring(0, MAX_VALUE_LENGTH).trim() : s;
    }

    private static boolean sameValue(String candidate, String existing) {
        return existing != null && Objects.equals(candidate.toLowerCase(), existing.toLowerCase());
    }
}
