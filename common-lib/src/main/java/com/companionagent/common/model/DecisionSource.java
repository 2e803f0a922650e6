package com.companionagent.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Which router stage produced the intent class of a {@link RouterDecision}. */
public enum DecisionSource {
    HARD_RULE, KEYWORD, REGEX, CLASSIFIER;

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }
}
