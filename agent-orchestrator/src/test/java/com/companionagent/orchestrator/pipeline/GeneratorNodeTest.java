package com.companionagent.orchestrator.pipeline;

import com.companionagent.common.exception.PipelineException;
import com.companionagent.common.exception.PipelineException.FailureKind;
import com.companionagent.common.model.AgentMode;
import com.companionagent.common.model.PipelineState;
import com.companionagent.common.model.Route;
import com.companionagent.orchestrator.completion.CompletionProviders;
import com.companionagent.orchestrator.completion.CompletionTask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static com.companionagent.orchestrator.TestStates.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class GeneratorNodeTest {

    private CompletionProviders providers;
    private GeneratorNode generator;

    @BeforeEach
    void setUp() {
        providers = mock(CompletionProviders.class);
        generator = new GeneratorNode(providers);
    }

    // ── draft ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("draft()")
    class DraftTests {

        @Test
        @DisplayName("route picks the draft tier and the mode caps the tokens")
        void tierAndTokens() {
            when(providers.complete(eq(CompletionTask.DRAFT_PRO), anyString(), anyString(),
                                    eq(GeneratorNode.DRAFT_TEMPERATURE), eq(AgentMode.VOICE.draftMaxTokens())))
                .thenReturn(Mono.just(reply("  Sure thing.  ")));

            PipelineState planned = state("tell me about mars", AgentMode.VOICE, Route.PRO).withPlan("Answer briefly");

            StepVerifier.create(generator.draft(planned))
                .assertNext(r -> assertEquals("Sure thing.", r.state().draft()))
                .verifyComplete();
        }

        @Test
        @DisplayName("provider failure leaves an error-marked draft")
        void failure() {
            when(providers.complete(any(), anyString(), anyString(), anyDouble(), anyInt()))
                .thenReturn(Mono.error(new PipelineException("anthropic", FailureKind.PROVIDER_FAILURE, "overloaded")));

            StepVerifier.create(generator.draft(state("hi", AgentMode.ASSISTANT).withPlan("Greet")))
                .assertNext(r -> {
                    assertTrue(GeneratorNode.isErrorDraft(r.state().draft()));
                    assertTrue(r.state().draft().contains("overloaded"));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("empty completion leaves an error-marked draft")
        void empty() {
            when(providers.complete(any(), anyString(), anyString(), anyDouble(), anyInt()))
                .thenReturn(Mono.just(reply("")));

            StepVerifier.create(generator.draft(state("hi", AgentMode.ASSISTANT).withPlan("Greet")))
                .assertNext(r -> assertTrue(GeneratorNode.isErrorDraft(r.state().draft())))
                .verifyComplete();
        }
    }

    // ── repair ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("repair()")
    class RepairTests {

        private PipelineState rejected() {
            return state("hi", AgentMode.ASSISTANT).withPlan("Greet").withDraft("Hi — there").rejected(List.of("em dash"));
        }

        @Test
        @DisplayName("repaired text replaces the draft, clears issues and keeps attempts")
        void repaired() {
            when(providers.complete(eq(CompletionTask.REPAIR), anyString(), anyString(), anyDouble(), anyInt()))
                .thenReturn(Mono.just(reply("Hi there")));

            StepVerifier.create(generator.repair(rejected()))
                .assertNext(r -> {
                    assertEquals("Hi there", r.state().draft());
                    assertTrue(r.state().critiqueIssues().isEmpty());
                    assertEquals(1, r.state().attempts());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("blank repair keeps the previous draft")
        void blank() {
            when(providers.complete(any(), anyString(), anyString(), anyDouble(), anyInt()))
                .thenReturn(Mono.just(reply(" ")));

            StepVerifier.create(generator.repair(rejected()))
                .assertNext(r -> assertEquals("Hi — there", r.state().draft()))
                .verifyComplete();
        }

        @Test
        @DisplayName("failed repair consumes an attempt and keeps the issues")
        void failure() {
            when(providers.complete(any(), anyString(), anyString(), anyDouble(), anyInt()))
                .thenReturn(Mono.error(new RuntimeException("timeout")));

            StepVerifier.create(generator.repair(rejected()))
                .assertNext(r -> {
                    assertEquals(2, r.state().attempts());
                    assertEquals(List.of("em dash"), r.state().critiqueIssues());
                })
                .verifyComplete();
        }
    }

    // ── prompts ────────────────────────────────────────────────────────────

    @Test
    @DisplayName("draft prompts carry hints, corrections and plan")
    void draftPrompts() {
        PipelineState s = PipelineState.initial("session-1", "turn-1", "hi", AgentMode.COMPANION, identity(),
                Route.NANO, "[Learned Preferences]\n- keep it short", "[Self-Correction]\nfix last reply")
            .withPlan("Greet back");

        String system = GeneratorNode.buildDraftSystemPrompt(s);
        assertTrue(system.startsWith("You are Luna, "));
        assertTrue(system.contains("[Learned Preferences]"));

        String user = GeneratorNode.buildDraftUserPrompt(s);
        assertTrue(user.indexOf("[Response Plan]") < user.indexOf("[Self-Correction]"));
        assertTrue(user.indexOf("[Self-Correction]") < user.indexOf("[User Message]"));
    }

    @Test
    @DisplayName("repair prompt lists every issue")
    void repairPrompt() {
        PipelineState s = state("hi", AgentMode.ASSISTANT).withPlan("Greet").withDraft("x").rejected(List.of("a", "b"));
        assertTrue(GeneratorNode.buildRepairUserPrompt(s).contains("[Issues to Fix]\n- a\n- b"));
    }
}
