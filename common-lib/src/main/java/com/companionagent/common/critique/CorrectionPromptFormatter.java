package com.companionagent.common.critique;

import com.companionagent.common.model.PendingCorrection;
import com.companionagent.common.model.Severity;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns unprocessed corrections into the prompt block of the next turn.
 *
 * <ul>
 *   <li>any serious correction: explicit acknowledgement of the first 3 issues</li>
 *   <li>moderate only: silent improvement on the first 2 issues</li>
 *   <li>minor only: nothing, hints cover those</li>
 * </ul>
 */
public final class CorrectionPromptFormatter {

    private CorrectionPromptFormatter() {}

    public static String format(List<PendingCorrection> corrections) {
        if (corrections == null || corrections.isEmpty()) return null;

        List<String> serious  = issuesOf(corrections, Severity.SERIOUS, 3);
        if (!serious.isEmpty()) {
            return "[Self-Correction Required]\n"
                + "In your previous response, you made some mistakes that need explicit correction.\n"
                + "Start your response by briefly acknowledging and correcting: " + String.join("; ", serious) + ".\n"
                + "Use a natural transition like \"Actually, let me rephrase...\" or \"I should clarify...\"";
        }

        List<String> moderate = issuesOf(corrections, Severity.MODERATE, 2);
        if (!moderate.isEmpty()) {
            return "[Subtle Improvement Needed]\n"
                + "Your previous response had minor issues. Without explicitly mentioning corrections,\n"
                + "naturally incorporate improvements for: " + String.join("; ", moderate) + ".\n"
                + "Do NOT say you are correcting anything - just do better this time.";
        }
        return null;
    }

    private static List<String> issuesOf(List<PendingCorrection> corrections, Severity severity, int limit) {
        return corrections.stream()
            .filter(c -> c.severity() == severity)
            .flatMap(c -> c.issues().stream())
            .limit(limit)
            .collect(Collectors.toList());
    }
}
