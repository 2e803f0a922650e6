package com.companionagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured approve/reject judgment of a draft. An approved verdict never carries issues.
 */
public record SupervisorVerdict(
    @JsonProperty("approved")         boolean      approved,
    @JsonProperty("issues")           List<String> issues,
    @JsonProperty("fix_instructions") String       fixInstructions
) {
    public SupervisorVerdict {
        issues = (approved || issues == null) ? List.of() : List.copyOf(issues);
        fixInstructions = fixInstructions == null ? "" : fixInstructions;
    }

    public static SupervisorVerdict approve() {
        return new SupervisorVerdict(true, List.of(), "");
    }

    public static SupervisorVerdict reject(List<String> issues, String fixInstructions) {
        return new SupervisorVerdict(false, issues, fixInstructions);
    }
}
