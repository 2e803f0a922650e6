package com.companionagent.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Intent class assigned to an inbound message by the router.
 */
public enum IntentClass {
    CHAT("chat"),
    TRANSFORM("transform"),
    FACTUAL("factual"),
    ACTIONABLE("actionable");

    private final String wire;

    IntentClass(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static IntentClass fromWire(String value) {
        for (IntentClass c : values()) {
            if (c.wire.equalsIgnoreCase(value)) return c;
        }
        throw new IllegalArgumentException("Unknown intent class: " + value);
    }
}
