package com.companionagent.common.critique;

import java.util.List;

/**
 * Fixed lookup from critique issue text to hint type.
 *
 * <p>Each issue is lower-cased and matched by substring against the keywords in table
 * order; the first match wins, so an issue yields at most one hint.
 */
public final class HintTaxonomy {

    public record HintType(String type, String text) {}

    private record Entry(String keyword, HintType hint) {}

    private static final HintType VERBOSE = new HintType("avoid_verbose", "Keep responses concise and to the point");

    private static final List<Entry> TABLE = List.of(
        new Entry("too verbose", VERBOSE),
        new Entry("verbose", VERBOSE),
        new Entry("chatbot", new HintType("avoid_chatbot",
            "Avoid generic chatbot phrases like \"How can I assist you today?\"")),
        new Entry("generic", new HintType("avoid_generic", "Be specific and personalized, avoid generic responses")),
        new Entry("robotic", new HintType("avoid_robotic", "Sound natural and human, not robotic")),
        new Entry("em dash", new HintType("avoid_emdash", "Never use em dash character")),
        new Entry("markdown", new HintType("avoid_markdown_voice", "No markdown formatting in voice mode")),
        new Entry("tool hallucination", new HintType("avoid_hallucination",
            "Only reference tools/data that were actually provided")),
        new Entry("too long", new HintType("avoid_long_voice", "Keep voice responses to 1-3 sentences")),
        new Entry("repetitive", new HintType("avoid_repetition", "Avoid repeating the same phrases or ideas")),
        new Entry("formal", new HintType("avoid_formal", "Use casual, friendly tone - not overly formal"))
    );

    private HintTaxonomy() {}

    /** @return the hint for one issue, or {@code null} when no keyword matches */
    public static HintType classify(String issue) {
        if (issue == null) return null;
        String lower = issue.toLowerCase();
        for (Entry e : TABLE) {
            if (lower.contains(e.keyword())) return e.hint();
        }
        return null;
    }
}
