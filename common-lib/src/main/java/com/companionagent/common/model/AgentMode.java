package com.companionagent.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Conversation mode of a turn. Each variant carries everything mode-dependent in the pipeline:
 * the draft token budget, whether responses are short-form (spoken), whether the mode is casual
 * enough for smalltalk to collapse the plan, and the static plan used when the planner fails.
 *
 * <p>Unknown or missing wire values resolve to {@link #ASSISTANT}.
 */
public enum AgentMode {

    ASSISTANT("assistant", 2000, false, false, List.of(
        "Identify exactly what the user is asking for",
        "Answer directly and accurately",
        "Offer one relevant next step if it helps")),

    COMPANION("companion", 2000, false, true, List.of(
        "Respond warmly and naturally to what the user said",
        "Keep the conversation going with a light follow-up")),

    VOICE("voice", 200, true, true, List.of(
        "Reply in one to three short spoken sentences")),

    DJ_LUNA("dj_luna", 2000, false, true, List.of(
        "React to the music request with energy",
        "Describe or suggest the music that fits")),

    CEO_LUNA("ceo_luna", 2000, false, false, List.of(
        "Identify the business question behind the message",
        "Give a concise, decision-oriented answer",
        "Flag the main risk or next action"));

    private final String wire;
    private final int draftMaxTokens;
    private final boolean shortForm;
    private final boolean casual;
    private final List<String> fallbackSteps;

    AgentMode(String wire, int draftMaxTokens, boolean shortForm, boolean casual,
              List<String> fallbackSteps) {
        this.wire           = wire;
        this.draftMaxTokens = draftMaxTokens;
        this.shortForm      = shortForm;
        this.casual         = casual;
        this.fallbackSteps  = fallbackSteps;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /** Token budget for draft and repair calls. */
    public int draftMaxTokens() {
        return draftMaxTokens;
    }

    /** Spoken modes: no markdown and a hard length ceiling. */
    public boolean isShortForm() {
        return shortForm;
    }

    /** Smalltalk collapses the plan to a single natural step in casual modes. */
    public boolean isCasual() {
        return casual;
    }

    /** Numbered, never-empty plan used when the planner cannot produce one. */
    public String fallbackPlan() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < fallbackSteps.size(); i++) {
            if (i > 0) sb.append('\n');
            sb.append(i + 1).append(". ").append(fallbackSteps.get(i));
        }
        return sb.toString();
    }

    @JsonCreator
    public static AgentMode fromWire(String value) {
        if (value == null) return ASSISTANT;
        for (AgentMode m : values()) {
            if (m.wire.equalsIgnoreCase(value.trim())) return m;
        }
        return ASSISTANT;
    }
}
