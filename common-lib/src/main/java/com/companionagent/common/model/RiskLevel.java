package com.companionagent.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskLevel {
    LOW, MEDIUM, HIGH;

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }
}
