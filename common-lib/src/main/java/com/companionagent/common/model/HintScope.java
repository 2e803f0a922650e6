package com.companionagent.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HintScope {
    SESSION, USER;

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }
}
