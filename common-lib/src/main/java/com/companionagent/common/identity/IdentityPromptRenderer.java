package com.companionagent.common.identity;

import com.companionagent.common.model.AgentMode;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders sections of an {@link IdentityProfile} into prompt text.
 *
 * <p>Every method returns an empty string when the identity has nothing for that section,
 * so callers can skip the section header. No side-effects.
 */
public final class IdentityPromptRenderer {

    private IdentityPromptRenderer() {}

    public static String sharedSpine(IdentityProfile identity) {
        IdentityProfile.SharedSpine spine = identity.sharedSpine();
        if (spine == null) return "";

        List<String> parts = new ArrayList<>();
        if (!spine.always().isEmpty()) parts.add("ALWAYS:\n" + bullets(spine.always()));
        if (!spine.never().isEmpty())  parts.add("NEVER:\n" + bullets(spine.never()));
        return String.join("\n\n", parts);
    }

    public static String norms(IdentityProfile identity) {
        List<String> sections = new ArrayList<>();
        for (IdentityProfile.NormType type : IdentityProfile.NormType.values()) {
            List<String> rules = identity.norms().stream()
                .filter(n -> n.type() == type)
                .map(IdentityProfile.Norm::rule)
                .toList();
            if (!rules.isEmpty()) {
                sections.add(type.name() + ":\n" + bullets(rules));
            }
        }
        return String.join("\n\n", sections);
    }

    /**
     * Guidelines for {@code mode}; an identity without that mode falls back to its
     * configured default mode, then to {@code assistant}.
     */
    public static String mode(IdentityProfile identity, AgentMode mode) {
        String key = resolveModeKey(identity, mode);
        IdentityProfile.ModeDefinition def = identity.modes().get(key);
        if (def == null) return "";

        List<String> parts = new ArrayList<>();
        parts.add("MODE: " + key.toUpperCase());
        parts.add("Purpose: " + def.purpose());
        parts.add("Tone: " + def.tone());
        if (!def.behavior().isEmpty()) parts.add("Behavior:\n" + bullets(def.behavior()));
        if (!def.rules().isEmpty())    parts.add("Rules:\n" + bullets(def.rules()));
        if (!def.language().isEmpty()) parts.add("Language style:\n" + bullets(def.language()));
        if (!def.examples().isEmpty()) {
            parts.add("Examples:\n" + def.examples().stream()
                .map(e -> "> " + e)
                .collect(Collectors.joining("\n")));
        }
        return String.join("\n\n", parts);
    }

    public static String style(IdentityProfile identity, AgentMode mode) {
        IdentityProfile.StyleGuidelines style = identity.styleGuidelines();
        List<String> parts = new ArrayList<>();
        if (style.communication() != null && !style.communication().isEmpty()) {
            parts.add("Communication:\n" + bullets(style.communication()));
        }
        if (style.formatting() != null && !style.formatting().isEmpty()) {
            parts.add("Formatting:\n" + bullets(style.formatting()));
        }
        if (mode != null) {
            List<String> specific = style.modeSpecific().get(mode.wire());
            if (specific != null && !specific.isEmpty()) {
                parts.add(capitalize(mode.wire()) + " Mode:\n" + bullets(specific));
            }
        }
        return String.join("\n\n", parts);
    }

    public static String rubric(IdentityProfile identity) {
        IdentityProfile.ComplianceRubric rubric = identity.complianceRubric();
        return "CRITICAL VIOLATIONS (immediate rejection):\n" + bullets(rubric.criticalViolations())
            + "\n\nMAJOR VIOLATIONS (require repair):\n" + bullets(rubric.majorViolations())
            + "\n\nMINOR VIOLATIONS (flag but may pass):\n" + bullets(rubric.minorViolations());
    }

    public static String capabilities(IdentityProfile identity) {
        if (identity.capabilities().isEmpty()) return "";
        return "Available Tools:\n" + identity.capabilities().stream()
            .map(c -> "- " + c.name() + ": " + c.description())
            .collect(Collectors.joining("\n"));
    }

    public static String guardrail(IdentityProfile identity) {
        if (identity.modeSwitching() == null || identity.modeSwitching().guardrail() == null) return "";
        IdentityProfile.Guardrail g = identity.modeSwitching().guardrail();
        return "GUARDRAIL: " + g.description()
            + "\nIf triggered, interrupt with: \"" + g.interruptPhrase() + "\"";
    }

    // ── helpers ────────────────────────────────────────────────────────────

    static String resolveModeKey(IdentityProfile identity, AgentMode mode) {
        if (mode != null && identity.modes().containsKey(mode.wire())) {
            return mode.wire();
        }
        if (identity.modeSwitching() != null && identity.modeSwitching().defaultMode() != null) {
            return identity.modeSwitching().defaultMode();
        }
        return AgentMode.ASSISTANT.wire();
    }

    private static String bullets(List<String> lines) {
        return lines.stream().map(l -> "- " + l).collect(Collectors.joining("\n"));
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
