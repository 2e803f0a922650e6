package com.companionagent.common.identity;

import com.companionagent.common.model.AgentMode;

import java.util.List;
import java.util.Map;

/**
 * Detects an explicit mode-switch request ("switch to voice mode", ...) using the
 * identity's configured trigger phrases. Case-insensitive substring match; the first
 * configured mode with a matching trigger wins.
 */
public final class ModeSwitchDetector {

    private ModeSwitchDetector() {}

    /**
     * @return the requested mode, or {@code null} when the message holds no explicit trigger
     *         or names a mode this platform does not know
     */
    public static AgentMode detect(IdentityProfile identity, String message) {
        if (identity.modeSwitching() == null || message == null) return null;

        String lower = message.toLowerCase();
        for (Map.Entry<String, List<String>> entry : identity.modeSwitching().explicitTriggers().entrySet()) {
            for (String trigger : entry.getValue()) {
                if (lower.contains(trigger.toLowerCase())) {
                    AgentMode mode = AgentMode.fromWire(entry.getKey());
                    return mode.wire().equalsIgnoreCase(entry.getKey()) ? mode : null;
                }
            }
        }
        return null;
    }
}
