package com.companionagent.common.supervisor;

import com.companionagent.common.model.AgentMode;
import com.companionagent.common.model.SupervisorVerdict;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Deterministic draft checks that run before the judge model.
 *
 * <p>A failing check is final: the caller must not consult the judge, so a lenient model
 * can never approve a draft these checks reject.
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class QuickComplianceChecks {

    public static final String EM_DASH_ISSUE       = "Contains em dash character which is forbidden";
    public static final String MARKDOWN_ISSUE      = "Voice mode response contains markdown formatting";
    public static final String TOO_LONG_ISSUE      = "Voice mode response is too long (should be 1-3 sentences)";
    public static final String HALLUCINATION_ISSUE = "Response appears to reference tool results that were not provided";

    static final int SHORT_FORM_MAX_CHARS = 500;

    private static final char EM_DASH = '\u2014';

    private static final List<Pattern> TOOL_CLAIMS = List.of(
        Pattern.compile("i found these results", Pattern.CASE_INSENSITIVE),
        Pattern.compile("according to my search", Pattern.CASE_INSENSITIVE),
        Pattern.compile("the weather (?:is|shows|indicates)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("your calendar shows", Pattern.CASE_INSENSITIVE)
    );

    private QuickComplianceChecks() {}

    /**
     * @return a rejecting verdict listing every failed check, or {@code null} when all pass
     */
    public static SupervisorVerdict check(String draft, AgentMode mode, List<String> relevantMemories) {
        String text = draft == null ? "" : draft;
        List<String> issues = new ArrayList<>();

        if (text.indexOf(EM_DASH) >= 0) {
            issues.add(EM_DASH_ISSUE);
        }

        if (mode != null && mode.isShortForm()) {
            if (text.contains("```") || text.contains("**") || text.contains("##")) {
                issues.add(MARKDOWN_ISSUE);
            }
            if (text.length() > SHORT_FORM_MAX_CHARS) {
                issues.add(TOO_LONG_ISSUE);
            }
        }

        if (claimsToolResults(text) && !hasToolMemory(relevantMemories)) {
            issues.add(HALLUCINATION_ISSUE);
        }

        return issues.isEmpty() ? null : SupervisorVerdict.reject(issues, fixInstructions(issues));
    }

    /** {@code "1. Fix: a; 2. Fix: b"} */
    public static String fixInstructions(List<String> issues) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < issues.size(); i++) {
            if (i > 0) sb.append("; ");
            sb.append(i + 1).append(". Fix: ").append(issues.get(i));
        }
        return sb.toString();
    }

    private static boolean claimsToolResults(String text) {
        for (Pattern p : TOOL_CLAIMS) {
            if (p.matcher(text).find()) return true;
        }
        return false;
    }

    private static boolean hasToolMemory(List<String> memories) {
        if (memories == null) return false;
        for (String m : memories) {
            if (m != null && (m.contains("search") || m.contains("calendar"))) return true;
        }
        return false;
    }
}
