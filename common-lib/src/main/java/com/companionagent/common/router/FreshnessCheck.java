package com.companionagent.common.router;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether answering a message needs live data.
 *
 * <p>A message needs fresh data when fresh-data signals outnumber static-knowledge
 * signals, or when there are fresh signals and no static ones. The reported patterns
 * are the side that won.
 */
public final class FreshnessCheck {

    public record FreshnessResult(boolean needsFreshData, List<String> matchedPatterns) {}

    private static final List<LabeledPattern> FRESH = List.of(
        LabeledPattern.of("\\b(current|currently|now|right\\s+now|at\\s+the\\s+moment)\\b", "current"),
        LabeledPattern.of("\\b(today|tonight|this\\s+morning|this\\s+afternoon)\\b", "today"),
        LabeledPattern.of("\\b(latest|newest|most\\s+recent|up\\s+to\\s+date)\\b", "latest"),
        LabeledPattern.of("\\b(live|real-?time|happening)\\b", "realtime"),
        LabeledPattern.of("\\b(price|prices|pricing|cost|costs|rate|rates)\\b", "prices"),
        LabeledPattern.of("\\b(stock|stocks|share|shares|market)\\b", "market"),
        LabeledPattern.of("\\b(weather|forecast|temperature|rain|snow)\\b", "weather"),
        LabeledPattern.of("\\b(score|scores|game|match|playing)\\b", "sports"),
        LabeledPattern.of("\\b(news|headlines|breaking)\\b", "news"),
        LabeledPattern.of("\\b(available|availability|open|closed|hours)\\b", "availability"),
        LabeledPattern.of("\\b(status|update|updates)\\b", "status"),
        LabeledPattern.of("\\b(traffic|delay|delays|delayed)\\b", "traffic"),
        LabeledPattern.of("\\b(flight|flights|departure|arrival)\\b", "flight"),
        LabeledPattern.of("\\b(near\\s+me|nearby|closest|nearest)\\b", "location"),
        LabeledPattern.of("\\b(trending|viral|popular|hot\\s+right\\s+now)\\b", "trending"),
        LabeledPattern.of("\\b(what\\s+is\\s+the\\s+current|what\\s+are\\s+the\\s+current)\\b", "explicit_current"),
        LabeledPattern.of("\\b(check|look\\s+up|find\\s+out)\\b", "lookup")
    );

    private static final List<LabeledPattern> STATIC = List.of(
        LabeledPattern.of("\\b(history|historical|historically)\\b", "history"),
        LabeledPattern.of("\\b(in\\s+the\\s+past|previously|back\\s+in)\\b", "past"),
        LabeledPattern.of("\\b(origin|origins|began|started|invented)\\b", "origin"),
        LabeledPattern.of("\\bexplain\\s+(the\\s+)?(concept|idea|theory|principle)", "concept"),
        LabeledPattern.of("\\b(define|definition|meaning\\s+of)\\b", "definition"),
        LabeledPattern.of("\\bwhat\\s+is\\s+(a|an|the)\\s+(concept|theory|principle)", "what_is_concept"),
        LabeledPattern.of("\\b(always|generally|typically|usually|normally)\\b", "general"),
        LabeledPattern.of("\\b(in\\s+general|on\\s+average|commonly)\\b", "common"),
        LabeledPattern.of("\\b(would|could|should|might)\\s+(be|have|do)\\b", "hypothetical"),
        LabeledPattern.of("\\bwhat\\s+if\\b", "what_if"),
        LabeledPattern.of("\\bhelp\\s+me\\s+understand\\b", "understand"),
        LabeledPattern.of("\\bcan\\s+you\\s+explain\\b", "explain")
    );

    private static final List<Pattern> OBVIOUSLY_FRESH = List.of(
        LabeledPattern.compile("\\b(price|weather|stock|score|traffic|flight|live|current)\\b"),
        LabeledPattern.compile("\\b(today|now|right\\s+now|latest)\\b")
    );

    private static final List<Pattern> OBVIOUSLY_STATIC = List.of(
        LabeledPattern.compile("\\b(history\\s+of|explain\\s+the\\s+concept|define|what\\s+does\\s+.+\\s+mean)\\b"),
        LabeledPattern.compile("\\b(how\\s+does\\s+.+\\s+work|difference\\s+between)\\b")
    );

    private FreshnessCheck() {}

    public static FreshnessResult check(String message) {
        String normalized = message.toLowerCase().trim();
        List<String> fresh = labels(normalized, FRESH);
        List<String> stat  = labels(normalized, STATIC);

        boolean needsFresh = (!fresh.isEmpty() && stat.isEmpty()) || fresh.size() > stat.size();
        return new FreshnessResult(needsFresh, needsFresh ? fresh : stat);
    }

    /** Network-free shortcut used by the quick route. */
    public static boolean obviouslyNeedsFreshData(String message) {
        return anyMatch(message, OBVIOUSLY_FRESH);
    }

    public static boolean obviouslyStatic(String message) {
        return anyMatch(message, OBVIOUSLY_STATIC);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    static List<String> labels(String text, List<LabeledPattern> table) {
        List<String> out = new ArrayList<>();
        for (LabeledPattern p : table) {
            if (p.matches(text)) out.add(p.label());
        }
        return List.copyOf(out);
    }

    static boolean anyMatch(String text, List<Pattern> patterns) {
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) return true;
        }
        return false;
    }
}
