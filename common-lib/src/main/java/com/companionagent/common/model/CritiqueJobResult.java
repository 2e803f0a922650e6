package com.companionagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CritiqueJobResult(
    @JsonProperty("approved")         boolean      approved,
    @JsonProperty("issues")           List<String> issues,
    @JsonProperty("fix_instructions") String       fixInstructions,
    @JsonProperty("severity")         Severity     severity,
    @JsonProperty("hints_generated")  List<String> hintsGenerated
) {
    public CritiqueJobResult {
        issues         = issues == null ? List.of() : List.copyOf(issues);
        hintsGenerated = hintsGenerated == null ? List.of() : List.copyOf(hintsGenerated);
    }
}
