package com.companionagent.common.identity;

import com.companionagent.common.model.AgentMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IdentityPromptRendererTest {

    static IdentityProfile identity() {
        Map<String, List<String>> explicit = new LinkedHashMap<>();
        explicit.put("voice", List.of("switch to voice mode", "talk to me"));
        explicit.put("companion", List.of("just chat"));
        explicit.put("pirate", List.of("talk like a pirate"));

        return new IdentityProfile(
            "luna", 3,
            new IdentityProfile.Traits("Luna", "BitwareLabs", "a personal companion", List.of("warm", "curious")),
            new IdentityProfile.SharedSpine(List.of("Be honest"), List.of("Use em dashes")),
            Map.of(
                "assistant", new IdentityProfile.ModeDefinition("Get things done", true,
                    List.of("Answer directly"), "focused", List.of("No filler"), List.of(), List.of("Done. Anything else?")),
                "voice", new IdentityProfile.ModeDefinition("Spoken replies", false,
                    List.of(), "relaxed", List.of("1-3 sentences"), List.of("contractions"), List.of())),
            new IdentityProfile.ModeSwitching("assistant", explicit, Map.of(),
                new IdentityProfile.Guardrail("Do not switch mode mid-task", "Want me to switch modes?")),
            List.of(
                new IdentityProfile.Norm(IdentityProfile.NormType.NEVER, "Invent tool results"),
                new IdentityProfile.Norm(IdentityProfile.NormType.MUST, "Match the user's language")),
            new IdentityProfile.StyleGuidelines(List.of("Short sentences"), List.of(),
                Map.of("voice", List.of("No lists"))),
            new IdentityProfile.ComplianceRubric(List.of("Em dash"), List.of("Robotic tone"), List.of("Too long")),
            null,
            null,
            List.of(new IdentityProfile.Capability("web_search", "Search the web", List.of("search"))));
    }

    @Nested
    @DisplayName("section rendering")
    class Sections {

        @Test
        @DisplayName("norms are grouped MUST, NEVER, SHOULD regardless of document order")
        void norms() {
            assertEquals("MUST:\n- Match the user's language\n\nNEVER:\n- Invent tool results",
                IdentityPromptRenderer.norms(identity()));
        }

        @Test
        @DisplayName("shared spine")
        void spine() {
            assertEquals("ALWAYS:\n- Be honest\n\nNEVER:\n- Use em dashes",
                IdentityPromptRenderer.sharedSpine(identity()));
        }

        @Test
        @DisplayName("known mode renders its own definition")
        void knownMode() {
            String voice = IdentityPromptRenderer.mode(identity(), AgentMode.VOICE);
            assertTrue(voice.startsWith("MODE: VOICE\n\nPurpose: Spoken replies"));
            assertTrue(voice.contains("Language style:\n- contractions"));
        }

        @Test
        @DisplayName("mode missing from the document falls back to the default mode")
        void fallbackMode() {
            String out = IdentityPromptRenderer.mode(identity(), AgentMode.DJ_LUNA);
            assertTrue(out.startsWith("MODE: ASSISTANT"));
            assertTrue(out.contains("Examples:\n> Done. Anything else?"));
        }

        @Test
        @DisplayName("style adds the mode-specific block")
        void style() {
            assertEquals("Communication:\n- Short sentences\n\nVoice Mode:\n- No lists",
                IdentityPromptRenderer.style(identity(), AgentMode.VOICE));
        }

        @Test
        @DisplayName("guardrail, capabilities and rubric")
        void misc() {
            assertEquals("GUARDRAIL: Do not switch mode mid-task\nIf triggered, interrupt with: \"Want me to switch modes?\"",
                IdentityPromptRenderer.guardrail(identity()));
            assertEquals("Available Tools:\n- web_search: Search the web", IdentityPromptRenderer.capabilities(identity()));
            assertTrue(IdentityPromptRenderer.rubric(identity()).startsWith("CRITICAL VIOLATIONS (immediate rejection):\n- Em dash"));
        }
    }

    @Nested
    @DisplayName("ModeSwitchDetector")
    class ModeSwitch {

        @Test
        @DisplayName("explicit trigger selects its mode")
        void trigger() {
            assertEquals(AgentMode.VOICE, ModeSwitchDetector.detect(identity(), "Can you SWITCH TO VOICE MODE please"));
            assertEquals(AgentMode.COMPANION, ModeSwitchDetector.detect(identity(), "let's just chat"));
        }

        @Test
        @DisplayName("no trigger or unknown mode → null")
        void none() {
            assertNull(ModeSwitchDetector.detect(identity(), "what's on my calendar"));
            assertNull(ModeSwitchDetector.detect(identity(), "talk like a pirate"));
        }
    }
}
