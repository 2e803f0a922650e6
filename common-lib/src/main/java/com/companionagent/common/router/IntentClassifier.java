package com.companionagent.common.router;

import com.companionagent.common.model.DecisionSource;
import com.companionagent.common.model.IntentClass;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword and regex intent classifier, the cheap first stage before the remote classifier.
 *
 * <p>Per class the score is {@code max(keywordScore, patternScore)}, where any keyword hit
 * scores {@link #KEYWORD_SCORE} and the pattern score is the highest weight among matching
 * patterns. The best class wins on strict {@code >} in declaration order of
 * {@link IntentClass}; with no signal at all the result is {@code factual} at 0.
 * Messages under 20 characters that score below 0.5 are treated as chat.
 */
public final class IntentClassifier {

    /** Below this confidence the router consults the remote classifier. */
    public static final double CONFIDENCE_THRESHOLD = 0.6;

    static final double KEYWORD_SCORE = 0.9;

    public record Classification(IntentClass intentClass, double confidence,
                                 DecisionSource source, List<String> matchedPatterns) {
        public boolean isConfident() {
            return confidence >= CONFIDENCE_THRESHOLD;
        }
    }

    private static final Map<IntentClass, List<String>> KEYWORDS = new EnumMap<>(Map.of(
        IntentClass.CHAT, List.of(
            "hi", "hello", "hey", "howdy", "greetings",
            "thanks", "thank you", "thx", "ty",
            "bye", "goodbye", "see you", "later", "cya",
            "how are you", "whats up", "what's up", "sup",
            "lol", "haha", "nice", "cool", "awesome", "great",
            "ok", "okay", "sure", "yep", "yes", "no", "nope",
            "good morning", "good afternoon", "good evening", "good night",
            "what do you think", "your opinion", "do you like",
            "tell me about yourself", "who are you",
            "interesting", "wow", "amazing", "i see", "got it"),
        IntentClass.TRANSFORM, List.of(
            "rewrite", "rephrase", "paraphrase",
            "summarize", "summary", "tldr", "tl;dr",
            "translate", "translation",
            "format", "reformat", "formatting",
            "convert", "conversion",
            "simplify", "make simpler", "explain like",
            "shorten", "make shorter", "condense",
            "expand", "elaborate", "make longer",
            "proofread", "fix grammar", "correct",
            "bullet points", "list format", "table format",
            "make it more", "make it less", "tone",
            "style", "formal", "informal", "casual", "professional"),
        IntentClass.FACTUAL, List.of(
            "what is", "what are", "whats", "what's",
            "who is", "who are", "whos", "who's",
            "explain", "explanation", "describe",
            "define", "definition", "meaning of",
            "history of", "origin of", "background",
            "how does", "how do", "how to",
            "why is", "why are", "why does", "why do",
            "difference between", "compare", "versus", "vs",
            "example of", "examples of", "such as",
            "list of", "types of", "kinds of",
            "concept", "theory", "principle",
            "when was", "where was", "where is"),
        IntentClass.ACTIONABLE, List.of(
            "buy", "purchase", "order", "checkout",
            "book", "reserve", "reservation", "schedule",
            "send", "email", "message", "text", "call",
            "create", "make", "generate", "build",
            "set", "set up", "configure", "setup",
            "remind", "reminder", "alert", "notify",
            "pay", "payment", "transfer", "wire",
            "cancel", "refund", "return",
            "subscribe", "unsubscribe", "sign up", "register",
            "download", "install", "update", "upgrade",
            "delete", "remove", "clear",
            "start", "stop", "pause", "resume",
            "enable", "disable", "turn on", "turn off",
            "connect", "disconnect", "link", "unlink",
            "submit", "apply", "file", "request")
    ));

    private static final Map<IntentClass, List<LabeledPattern>> PATTERNS = new EnumMap<>(Map.of(
        IntentClass.CHAT, List.of(
            LabeledPattern.weighted("^(hi|hello|hey|howdy)[\\s!.?,]*$", 1.0),
            LabeledPattern.weighted("^(thanks|thank\\s+you|thx|ty)[\\s!.?,]*$", 1.0),
            LabeledPattern.weighted("^(ok|okay|sure|yep|yes|no|nope)[\\s!.?,]*$", 0.9),
            LabeledPattern.weighted("^good\\s+(morning|afternoon|evening|night)", 1.0),
            LabeledPattern.weighted("what\\s+do\\s+you\\s+think", 0.8),
            LabeledPattern.weighted("your\\s+opinion", 0.8),
            LabeledPattern.weighted("^(lol|haha|hahaha|lmao|rofl)[\\s!.?,]*$", 1.0)),
        IntentClass.TRANSFORM, List.of(
            LabeledPattern.weighted("\\b(rewrite|rephrase|paraphrase)\\s+(this|the|my)", 1.0),
            LabeledPattern.weighted("\\b(summarize|summary\\s+of)\\s", 1.0),
            LabeledPattern.weighted("\\b(translate|translation)\\s+(to|into|from)", 1.0),
            LabeledPattern.weighted("\\bconvert\\s+(this|it|the)\\s+to\\b", 1.0),
            LabeledPattern.weighted("\\bmake\\s+(it|this)\\s+(shorter|longer|simpler|formal|casual)", 0.9),
            LabeledPattern.weighted("\\b(fix|correct)\\s+(the\\s+)?(grammar|spelling|errors)", 0.9),
            LabeledPattern.weighted("\\bput\\s+(this|it)\\s+in\\s+(bullet|list|table)", 0.9),
            LabeledPattern.weighted("\\bformat\\s+(this|it)\\s+as\\b", 0.9)),
        IntentClass.FACTUAL, List.of(
            LabeledPattern.weighted("^what\\s+(is|are|was|were)\\s", 0.9),
            LabeledPattern.weighted("^who\\s+(is|are|was|were)\\s", 0.9),
            LabeledPattern.weighted("^why\\s+(is|are|does|do|did)\\s", 0.8),
            LabeledPattern.weighted("^how\\s+(does|do|did|is|are)\\s", 0.8),
            LabeledPattern.weighted("^when\\s+(was|were|is|did)\\s", 0.8),
            LabeledPattern.weighted("^where\\s+(is|are|was|were)\\s", 0.8),
            LabeledPattern.weighted("\\bexplain\\s+(to\\s+me\\s+)?(what|how|why)", 0.9),
            LabeledPattern.weighted("\\b(define|definition\\s+of)\\s", 1.0),
            LabeledPattern.weighted("\\bdifference\\s+between\\s", 0.9),
            LabeledPattern.weighted("\\bhistory\\s+of\\s", 0.9)),
        IntentClass.ACTIONABLE, List.of(
            LabeledPattern.weighted("\\b(buy|purchase|order)\\s+(me\\s+)?(a|an|the|some)", 1.0),
            LabeledPattern.weighted("\\b(book|reserve|schedule)\\s+(a|an|the|my)", 1.0),
            LabeledPattern.weighted("\\b(send|email|message)\\s+(a|an|the|this|to)", 1.0),
            LabeledPattern.weighted("\\b(set|create)\\s+(a\\s+)?(reminder|alert|alarm)", 1.0),
            LabeledPattern.weighted("\\bremind\\s+me\\s+(to|about|in|at)", 1.0),
            LabeledPattern.weighted("\\b(pay|transfer|wire)\\s+(\\$|money|funds)", 1.0),
            LabeledPattern.weighted("\\b(cancel|refund)\\s+(my|the|this)", 1.0),
            LabeledPattern.weighted("\\b(sign\\s+up|register|subscribe)\\s+(for|to)", 1.0),
            LabeledPattern.weighted("\\b(turn\\s+on|turn\\s+off|enable|disable)\\s", 0.9),
            LabeledPattern.weighted("\\bcan\\s+you\\s+(please\\s+)?(send|book|schedule|create|set)", 0.9),
            LabeledPattern.weighted("\\bplease\\s+(send|book|schedule|create|set|remind)", 0.9))
    ));

    private static final Map<String, Pattern> KEYWORD_BOUNDARIES = new HashMap<>();

    static {
        KEYWORDS.values().forEach(list -> list.forEach(k ->
            KEYWORD_BOUNDARIES.put(k, LabeledPattern.compile("\\b" + Pattern.quote(k) + "\\b"))));
    }

    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,!?]+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private IntentClassifier() {}

    public static Classification classify(String message) {
        String normalized = normalize(message);

        Map<IntentClass, Double> keywordScores = new EnumMap<>(IntentClass.class);
        Map<IntentClass, Double> patternScores = new EnumMap<>(IntentClass.class);
        for (IntentClass c : IntentClass.values()) {
            keywordScores.put(c, hasKeyword(normalized, KEYWORDS.get(c)) ? KEYWORD_SCORE : 0.0);
            patternScores.put(c, scorePatterns(normalized, PATTERNS.get(c)));
        }

        IntentClass best = IntentClass.FACTUAL;
        double bestScore = 0.0;
        DecisionSource source = DecisionSource.KEYWORD;
        for (IntentClass c : IntentClass.values()) {
            double score = Math.max(keywordScores.get(c), patternScores.get(c));
            if (score > bestScore) {
                bestScore = score;
                best = c;
                source = patternScores.get(c) > keywordScores.get(c)
                    ? DecisionSource.REGEX : DecisionSource.KEYWORD;
            }
        }

        if (normalized.length() < 20 && bestScore < 0.5) {
            return new Classification(IntentClass.CHAT, 0.7, DecisionSource.KEYWORD, List.of("short_message"));
        }

        List<String> matched = new ArrayList<>();
        for (IntentClass c : IntentClass.values()) {
            if (patternScores.get(c) > 0) {
                for (LabeledPattern p : PATTERNS.get(c)) {
                    if (p.matches(normalized)) matched.add(c.wire() + ":" + p.sourcePrefix());
                }
            }
        }
        return new Classification(best, bestScore, source, List.copyOf(matched));
    }

    // ── helpers ────────────────────────────────────────────────────────────

    static String normalize(String text) {
        String s = text.toLowerCase().trim();
        s = TRAILING_PUNCTUATION.matcher(s).replaceAll("");
        return WHITESPACE.matcher(s).replaceAll(" ");
    }

    static boolean hasKeyword(String normalized, List<String> keywords) {
        for (String keyword : keywords) {
            if (normalized.equals(keyword)
                    || normalized.startsWith(keyword + " ")
                    || normalized.startsWith(keyword + ",")) {
                return true;
            }
            Pattern wordBoundary = KEYWORD_BOUNDARIES.get(keyword);
            if (wordBoundary != null && wordBoundary.matcher(normalized).find()) return true;
        }
        return false;
    }

    private static double scorePatterns(String text, List<LabeledPattern> patterns) {
        double max = 0.0;
        for (LabeledPattern p : patterns) {
            if (p.matches(text)) max = Math.max(max, p.weight());
        }
        return max;
    }
}
