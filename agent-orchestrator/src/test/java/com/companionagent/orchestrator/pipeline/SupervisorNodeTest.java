package com.companionagent.orchestrator.pipeline;

import com.companionagent.common.exception.PipelineException;
import com.companionagent.common.exception.PipelineException.FailureKind;
import com.companionagent.common.model.AgentMode;
import com.companionagent.common.model.PipelineState;
import com.companionagent.common.supervisor.QuickComplianceChecks;
import com.companionagent.orchestrator.completion.CompletionProviders;
import com.companionagent.orchestrator.completion.CompletionTask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static com.companionagent.orchestrator.TestStates.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SupervisorNodeTest {

    private CompletionProviders providers;
    private SupervisorNode supervisor;

    @BeforeEach
    void setUp() {
        providers  = mock(CompletionProviders.class);
        supervisor = new SupervisorNode(providers, MAPPER);
    }

    private static PipelineState drafted(String draft, AgentMode mode) {
        return state("hey", mode).withPlan("Greet back").withDraft(draft);
    }

    private void judgeReplies(String reply) {
        when(providers.complete(eq(CompletionTask.JUDGE), anyString(), anyString(), anyDouble(), anyInt()))
            .thenReturn(Mono.just(reply(reply)));
    }

    // ── quick checks ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("quick checks")
    class QuickCheckTests {

        @Test
        @DisplayName("failed quick check decides the verdict without calling the judge")
        void quickCheckWins() {
            StepVerifier.create(supervisor.review(drafted("Sure — here it is", AgentMode.ASSISTANT)))
                .assertNext(s -> {
                    assertFalse(s.verdict().approved());
                    assertEquals(List.of(QuickComplianceChecks.EM_DASH_ISSUE), s.state().critiqueIssues());
                    assertEquals(1, s.state().attempts());
                    assertNull(s.usage());
                })
                .verifyComplete();

            verifyNoInteractions(providers);
        }

        @Test
        @DisplayName("voice draft with markdown is rejected without a judge call")
        void voiceMarkdown() {
            StepVerifier.create(supervisor.review(drafted("**Bold** answer", AgentMode.VOICE)))
                .assertNext(s -> assertTrue(s.state().critiqueIssues().contains(QuickComplianceChecks.MARKDOWN_ISSUE)))
                .verifyComplete();

            verifyNoInteractions(providers);
        }
    }

    // ── judge ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("judge")
    class JudgeTests {

        @Test
        @DisplayName("approval sets the final output and counts one attempt")
        void approved() {
            judgeReplies("{\"approved\": true, \"issues\": []}");

            StepVerifier.create(supervisor.review(drafted("Hey! Good to see you.", AgentMode.COMPANION)))
                .assertNext(s -> {
                    assertTrue(s.verdict().approved());
                    assertEquals("Hey! Good to see you.", s.state().finalOutput());
                    assertEquals(1, s.state().attempts());
                    assertEquals(15, s.toNodeResult().inputTokens() + s.toNodeResult().outputTokens());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("rejection records the issues for repair")
        void rejected() {
            judgeReplies("{\"approved\": false, \"issues\": [\"Generic chatbot phrasing\"], \"fix_instructions\": \"be specific\"}");

            StepVerifier.create(supervisor.review(drafted("How can I assist you today?", AgentMode.ASSISTANT)))
                .assertNext(s -> {
                    assertFalse(s.verdict().approved());
                    assertEquals(List.of("Generic chatbot phrasing"), s.state().critiqueIssues());
                    assertNull(s.state().finalOutput());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("unreadable verdict approves when failing open")
        void unreadableFailOpen() {
            judgeReplies("I think it's fine");

            StepVerifier.create(supervisor.review(drafted("Hello!", AgentMode.ASSISTANT)))
                .assertNext(s -> assertTrue(s.verdict().approved()))
                .verifyComplete();
        }

        @Test
        @DisplayName("unreadable verdict rejects when failing closed")
        void unreadableFailClosed() {
            ReflectionTestUtils.setField(supervisor, "failOpen", false);
            judgeReplies("I think it's fine");

            StepVerifier.create(supervisor.review(drafted("Hello!", AgentMode.ASSISTANT)))
                .assertNext(s -> {
                    assertFalse(s.verdict().approved());
                    assertEquals(List.of(SupervisorNode.REVIEW_UNAVAILABLE_ISSUE), s.state().critiqueIssues());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("judge failure falls back to the configured verdict")
        void judgeError() {
            when(providers.complete(any(), anyString(), anyString(), anyDouble(), anyInt()))
                .thenReturn(Mono.error(new PipelineException("groq", FailureKind.PROVIDER_FAILURE, "down")));

            StepVerifier.create(supervisor.review(drafted("Hello!", AgentMode.ASSISTANT)))
                .assertNext(s -> {
                    assertTrue(s.verdict().approved());
                    assertEquals(1, s.state().attempts());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("judge exceeding its timeout approves when failing open")
        void judgeTimeoutFailOpen() {
            ReflectionTestUtils.setField(supervisor, "judgeTimeoutMs", 50L);
            when(providers.complete(any(), anyString(), anyString(), anyDouble(), anyInt())).thenReturn(Mono.never());

            StepVerifier.create(supervisor.review(drafted("Hello!", AgentMode.ASSISTANT)))
                .assertNext(s -> {
                    assertTrue(s.verdict().approved());
                    assertNull(s.usage());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("judge exceeding its timeout rejects when failing closed")
        void judgeTimeoutFailClosed() {
            ReflectionTestUtils.setField(supervisor, "judgeTimeoutMs", 50L);
            ReflectionTestUtils.setField(supervisor, "failOpen", false);
            when(providers.complete(any(), anyString(), anyString(), anyDouble(), anyInt())).thenReturn(Mono.never());

            StepVerifier.create(supervisor.review(drafted("Hello!", AgentMode.ASSISTANT)))
                .assertNext(s -> assertEquals(List.of(SupervisorNode.REVIEW_UNAVAILABLE_ISSUE), s.state().critiqueIssues()))
                .verifyComplete();
        }
    }

    @Test
    @DisplayName("review prompt carries rubric, user message and draft")
    void supervisorPrompt() {
        String prompt = SupervisorNode.buildSupervisorPrompt(drafted("Hello!", AgentMode.ASSISTANT));

        assertTrue(prompt.contains("[Behavioral Rules]"));
        assertTrue(prompt.contains("[Compliance Rubric]"));
        assertTrue(prompt.contains("[Original User Message]\nhey"));
        assertTrue(prompt.contains("[Draft Response to Review]\nHello!"));
        assertTrue(prompt.endsWith("Output JSON verdict."));
    }
}
