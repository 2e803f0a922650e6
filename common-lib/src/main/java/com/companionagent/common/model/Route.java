package com.companionagent.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Compute tier selected for a turn, in increasing order of cost and capability.
 *
 * <ul>
 *   <li>{@link #NANO}: small fast model, no tools</li>
 *   <li>{@link #PRO}: full model, no tools</li>
 *   <li>{@link #PRO_TOOLS}: full model with tool access</li>
 * </ul>
 */
public enum Route {
    NANO("nano"),
    PRO("pro"),
    PRO_TOOLS("pro+tools");

    private final String wire;

    Route(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public boolean usesTools() {
        return this == PRO_TOOLS;
    }

    @JsonCreator
    public static Route fromWire(String value) {
        for (Route r : values()) {
            if (r.wire.equalsIgnoreCase(value)) return r;
        }
        throw new IllegalArgumentException("Unknown route: " + value);
    }
}
