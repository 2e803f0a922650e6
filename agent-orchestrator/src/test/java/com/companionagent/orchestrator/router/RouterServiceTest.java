package com.companionagent.orchestrator.router;

import com.companionagent.common.exception.PipelineException;
import com.companionagent.common.exception.PipelineException.FailureKind;
import com.companionagent.common.model.DecisionSource;
import com.companionagent.common.model.IntentClass;
import com.companionagent.common.model.Route;
import com.companionagent.common.model.RouterDecision;
import com.companionagent.orchestrator.completion.CompletionProviders;
import com.companionagent.orchestrator.completion.CompletionTask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;

import static com.companionagent.orchestrator.TestStates.reply;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RouterServiceTest {

    private static final RouterService.RouterContext CONTEXT = new RouterService.RouterContext("user-1", "session-1");
    private static final String UNCLEAR = "purple elephants dancing quietly under moonlight";

    private CompletionProviders providers;
    private RouterService router;

    @BeforeEach
    void setUp() {
        providers = mock(CompletionProviders.class);
        router = new RouterService(providers, new ClassifierCache(Clock.systemUTC(), () -> 1.0));
        ReflectionTestUtils.setField(router, "classifierTimeoutMs", 200L);
    }

    // ── route() ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("route()")
    class RouteTests {

        @Test
        @DisplayName("hard escalation skips classification and never calls the classifier")
        void hardEscalation() {
            StepVerifier.create(router.route("book me a flight to NYC tomorrow", CONTEXT))
                .assertNext(d -> {
                    assertEquals(Route.PRO_TOOLS, d.route());
                    assertEquals(DecisionSource.HARD_RULE, d.decisionSource());
                    assertTrue(d.needsTools());
                    assertFalse(d.matchedPatterns().isEmpty());
                })
                .verifyComplete();

            verifyNoInteractions(providers);
        }

        @Test
        @DisplayName("greeting is routed to nano from the local tables")
        void greetingIsNano() {
            StepVerifier.create(router.route("hi there", CONTEXT))
                .assertNext(d -> {
                    assertEquals(IntentClass.CHAT, d.intentClass());
                    assertEquals(Route.NANO, d.route());
                })
                .verifyComplete();

            verifyNoInteractions(providers);
        }

        @Test
        @DisplayName("unclear message asks the classifier and uses its answer")
        void classifierFallback() {
            when(providers.complete(eq(CompletionTask.CLASSIFIER), anyString(), eq(UNCLEAR), anyDouble(), anyInt()))
                .thenReturn(Mono.just(reply("transform")));

            StepVerifier.create(router.route(UNCLEAR, CONTEXT))
                .assertNext(d -> {
                    assertEquals(IntentClass.TRANSFORM, d.intentClass());
                    assertEquals(DecisionSource.CLASSIFIER, d.decisionSource());
                    assertTrue(d.matchedPatterns().contains(RouterService.CLASSIFIER_PATTERN));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("same message routes the same way once the classifier result is cached")
        void deterministicWithWarmCache() {
            when(providers.complete(eq(CompletionTask.CLASSIFIER), anyString(), anyString(), anyDouble(), anyInt()))
                .thenReturn(Mono.just(reply("chat")));

            RouterDecision first  = router.route(UNCLEAR, CONTEXT).block();
            RouterDecision second = router.route(UNCLEAR, CONTEXT).block();

            assertNotNull(first);
            assertTrue(first.sameRouting(second));
            verify(providers, times(1)).complete(any(), anyString(), anyString(), anyDouble(), anyInt());
        }

        @Test
        @DisplayName("classifier failure degrades to factual, never chat")
        void classifierErrorIsFactual() {
            when(providers.complete(any(), anyString(), anyString(), anyDouble(), anyInt()))
                .thenReturn(Mono.error(new PipelineException("groq", FailureKind.PROVIDER_FAILURE, "503")));

            StepVerifier.create(router.route(UNCLEAR, CONTEXT))
                .assertNext(d -> {
                    assertEquals(IntentClass.FACTUAL, d.intentClass());
                    assertNotEquals(Route.NANO, d.route());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("classifier timeout degrades to factual")
        void classifierTimeoutIsFactual() {
            when(providers.complete(any(), anyString(), anyString(), anyDouble(), anyInt()))
                .thenReturn(Mono.never());

            StepVerifier.create(router.route(UNCLEAR, CONTEXT))
                .assertNext(d -> assertEquals(IntentClass.FACTUAL, d.intentClass()))
                .verifyComplete();
        }
    }

    // ── helpers ────────────────────────────────────────────────────────────

    @Test
    @DisplayName("unexpected classifier reply reads as factual")
    void parseUnexpectedReply() {
        assertEquals(IntentClass.ACTIONABLE, RouterService.parseClassifierReply(" Actionable\n", "m"));
        assertEquals(IntentClass.FACTUAL, RouterService.parseClassifierReply("no idea", "m"));
        assertEquals(IntentClass.FACTUAL, RouterService.parseClassifierReply(null, "m"));
    }

    @Test
    @DisplayName("quickRouteCheck answers hard escalations and leaves unclear messages to full analysis")
    void quickRouteCheck() {
        assertEquals(Route.PRO_TOOLS, router.quickRouteCheck("what's the weather tomorrow"));
        assertNull(router.quickRouteCheck(UNCLEAR));
    }
}
