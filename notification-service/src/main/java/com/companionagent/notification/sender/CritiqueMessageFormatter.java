package com.companionagent.notification.sender;

import com.companionagent.common.model.CritiqueReviewNotification;
import com.companionagent.common.model.Severity;

/**
 * Renders a review outcome as Slack mrkdwn. Pure, no I/O.
 */
public final class CritiqueMessageFormatter {

    private CritiqueMessageFormatter() {}

    public static String format(CritiqueReviewNotification n) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("*%s %s* | `turnId: %s`%n", emoji(n), n.title(), n.turnId()));
        sb.append(String.format("_%s_%n", n.message()));
        sb.append(String.format("session=`%s` user=`%s`", n.sessionId(), n.userId()));
        if (!n.approved()) {
            sb.append(String.format("%nissues=%d severity=`%s`", n.issueCount(), severityLabel(n.severity())));
        }
        return sb.toString();
    }

    private static String severityLabel(Severity severity) {
        return severity == null ? "unknown" : severity.wire();
    }

    private static String emoji(CritiqueReviewNotification n) {
        if (n.approved()) return "🟢";
        if (n.severity() == null) return "⚪";
        return switch (n.severity()) {
            case SERIOUS  -> "🔴";
            case MODERATE -> "🟡";
            case MINOR    -> "⚪";
        };
    }
}
