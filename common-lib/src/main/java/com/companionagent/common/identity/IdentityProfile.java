package com.companionagent.common.identity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Versioned identity and style document: traits, a mode-independent shared spine,
 * per-mode guidelines, behavioural norms, style rules, the mode-switch guardrail,
 * capabilities and the compliance rubric used by the supervisor.
 *
 * <p>Documents are supplied from outside (database or classpath seed) and are only
 * rendered into prompt text here, never authored or validated beyond deserialisation.
 * A stored version is immutable; a change produces a new version.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IdentityProfile(
    @JsonProperty("id")                String                      id,
    @JsonProperty("version")           int                         version,
    @JsonProperty("traits")            Traits                      traits,
    @JsonProperty("shared_spine")      SharedSpine                 sharedSpine,
    @JsonProperty("modes")             Map<String, ModeDefinition> modes,
    @JsonProperty("mode_switching")    ModeSwitching               modeSwitching,
    @JsonProperty("norms")             List<Norm>                  norms,
    @JsonProperty("style_guidelines")  StyleGuidelines             styleGuidelines,
    @JsonProperty("compliance_rubric") ComplianceRubric            complianceRubric,
    @JsonProperty("tool_gating")       ToolGating                  toolGating,
    @JsonProperty("delegation")        Map<String, Delegation>     delegation,
    @JsonProperty("capabilities")      List<Capability>            capabilities
) {
    public IdentityProfile {
        modes        = modes == null ? Map.of() : Map.copyOf(modes);
        norms        = norms == null ? List.of() : List.copyOf(norms);
        delegation   = delegation == null ? Map.of() : Map.copyOf(delegation);
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        if (styleGuidelines == null) styleGuidelines = new StyleGuidelines(null, null, null);
        if (complianceRubric == null) complianceRubric = new ComplianceRubric(List.of(), List.of(), List.of());
    }

    /** {@code id@version}, the form used in logs and pins. */
    public String ref() {
        return id + "@" + version;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Traits(
        @JsonProperty("name")        String       name,
        @JsonProperty("creator")     String       creator,
        @JsonProperty("role")        String       role,
        @JsonProperty("personality") List<String> personality
    ) {
        public Traits {
            personality = personality == null ? List.of() : List.copyOf(personality);
        }
    }

    public record SharedSpine(
        @JsonProperty("always") List<String> always,
        @JsonProperty("never")  List<String> never
    ) {
        public SharedSpine {
            always = always == null ? List.of() : List.copyOf(always);
            never  = never == null ? List.of() : List.copyOf(never);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ModeDefinition(
        @JsonProperty("purpose")  String       purpose,
        @JsonProperty("default")  Boolean      isDefault,
        @JsonProperty("behavior") List<String> behavior,
        @JsonProperty("tone")     String       tone,
        @JsonProperty("rules")    List<String> rules,
        @JsonProperty("language") List<String> language,
        @JsonProperty("examples") List<String> examples
    ) {
        public ModeDefinition {
            behavior = behavior == null ? List.of() : List.copyOf(behavior);
            rules    = rules == null ? List.of() : List.copyOf(rules);
            language = language == null ? List.of() : List.copyOf(language);
            examples = examples == null ? List.of() : List.copyOf(examples);
        }
    }

    public record ModeSwitching(
        @JsonProperty("default")           String                    defaultMode,
        @JsonProperty("explicit_triggers") Map<String, List<String>> explicitTriggers,
        @JsonProperty("implicit_triggers") Map<String, List<String>> implicitTriggers,
        @JsonProperty("guardrail")         Guardrail                 guardrail
    ) {
        public ModeSwitching {
            // trigger order decides which mode wins when several match
            explicitTriggers = explicitTriggers == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(explicitTriggers));
            implicitTriggers = implicitTriggers == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(implicitTriggers));
        }
    }

    public record Guardrail(
        @JsonProperty("description")      String description,
        @JsonProperty("interrupt_phrase") String interruptPhrase
    ) {}

    public enum NormType {
        MUST, NEVER, SHOULD;

        @JsonValue
        public String wire() {
            return name().toLowerCase();
        }
    }

    public record Norm(
        @JsonProperty("type") NormType type,
        @JsonProperty("rule") String   rule
    ) {}

    public record StyleGuidelines(
        @JsonProperty("communication") List<String>              communication,
        @JsonProperty("formatting")    List<String>              formatting,
        @JsonProperty("mode_specific") Map<String, List<String>> modeSpecific
    ) {
        public StyleGuidelines {
            modeSpecific = modeSpecific == null ? Map.of() : Map.copyOf(modeSpecific);
        }
    }

    public record ComplianceRubric(
        @JsonProperty("critical_violations") List<String> criticalViolations,
        @JsonProperty("major_violations")    List<String> majorViolations,
        @JsonProperty("minor_violations")    List<String> minorViolations
    ) {
        public ComplianceRubric {
            criticalViolations = criticalViolations == null ? List.of() : List.copyOf(criticalViolations);
            majorViolations    = majorViolations == null ? List.of() : List.copyOf(majorViolations);
            minorViolations    = minorViolations == null ? List.of() : List.copyOf(minorViolations);
        }
    }

    public record ToolGating(
        @JsonProperty("smalltalk_triggers") List<String>              smalltalkTriggers,
        @JsonProperty("tool_keywords")      Map<String, List<String>> toolKeywords
    ) {}

    public record Delegation(
        @JsonProperty("triggers")    List<String> triggers,
        @JsonProperty("description") String       description
    ) {}

    public record Capability(
        @JsonProperty("name")        String       name,
        @JsonProperty("description") String       description,
        @JsonProperty("triggers")    List<String> triggers
    ) {}
}
