package com.companionagent.common.critique;

import com.companionagent.common.model.Hint;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders active hints as the generator's tuning block.
 *
 * <p>Session hints come first; user hints follow unless a session hint already covered
 * their type. Returns {@code null} when nothing is left to inject.
 */
public final class HintPromptFormatter {

    public static final String HEADER = "[Personality Tuning - Based on Recent Feedback]";

    private HintPromptFormatter() {}

    public static String format(List<Hint> sessionHints, List<Hint> userHints) {
        Set<String> seenTypes = new HashSet<>();
        List<String> lines = new ArrayList<>();

        for (Hint h : sessionHints) {
            if (seenTypes.add(h.type())) lines.add("- " + h.text());
        }
        for (Hint h : userHints) {
            if (seenTypes.add(h.type())) {
                String prefix = h.weight() >= HintWeightPolicy.IMPORTANT_AT ? "IMPORTANT: " : "";
                lines.add("- " + prefix + h.text());
            }
        }

        if (lines.isEmpty()) return null;
        return HEADER + "\n" + String.join("\n", lines);
    }
}
