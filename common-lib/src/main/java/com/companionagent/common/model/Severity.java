package com.companionagent.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Severity of a reviewed response, derived only from its issue count. */
public enum Severity {
    MINOR, MODERATE, SERIOUS;

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }

    /** 0 issues → minor, 1–2 → moderate, 3+ → serious. */
    public static Severity fromIssueCount(int issueCount) {
        if (issueCount >= 3) return SERIOUS;
        if (issueCount >= 1) return MODERATE;
        return MINOR;
    }

    public static Severity fromWire(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
