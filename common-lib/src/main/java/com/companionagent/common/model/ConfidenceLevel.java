package com.companionagent.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Level of verification a routed answer must meet. */
public enum ConfidenceLevel {
    ESTIMATE, VERIFIED;

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }
}
