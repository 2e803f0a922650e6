package com.companionagent.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StateEventType {
    INTERACTION,
    TOPIC_SHIFT,
    MOOD_CHANGE,
    TASK_UPDATE,
    USER_GOAL;

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }

    public static StateEventType fromWire(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
