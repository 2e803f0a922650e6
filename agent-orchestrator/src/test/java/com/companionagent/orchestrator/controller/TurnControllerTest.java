package com.companionagent.orchestrator.controller;

import com.companionagent.orchestrator.api.TurnRequest;
import com.companionagent.orchestrator.api.TurnResponse;
import com.companionagent.orchestrator.api.TurnStreamEvent;
import com.companionagent.orchestrator.service.ChatTurnService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TurnControllerTest {

    private ChatTurnService chatTurnService;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        chatTurnService = mock(ChatTurnService.class);
        client = WebTestClient.bindToController(new TurnController(chatTurnService)).build();
    }

    @Test
    @DisplayName("turn is delegated and answered as JSON")
    void turn() {
        when(chatTurnService.processTurn(any())).thenReturn(Mono.just(
            new TurnResponse("turn-1", "Hi!", true, 1, true, 42, "nano", null, null, null)));

        client.post().uri("/api/v1/turns")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new TurnRequest("session-1", "user-1", "hey", "companion", "web"))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.turnId").isEqualTo("turn-1")
            .jsonPath("$.content").isEqualTo("Hi!")
            .jsonPath("$.route").isEqualTo("nano")
            .jsonPath("$.decision").doesNotExist();
    }

    @Test
    @DisplayName("blank message is a bad request and never reaches the service")
    void blankMessage() {
        client.post().uri("/api/v1/turns")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new TurnRequest("session-1", "user-1", "  ", null, null))
            .exchange()
            .expectStatus().isBadRequest();

        verify(chatTurnService, never()).processTurn(any());
    }

    @Test
    @DisplayName("stream endpoint emits the service events in order")
    void stream() {
        TurnResponse response = new TurnResponse("turn-2", "Hello", true, 1, true, 10, "nano", null, null, null);
        when(chatTurnService.streamTurn(any())).thenReturn(Flux.just(
            TurnStreamEvent.status(TurnStreamEvent.PREPARING),
            TurnStreamEvent.content("Hello"),
            TurnStreamEvent.done(response)));

        List<TurnStreamEvent> events = client.post().uri("/api/v1/turns/stream")
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.TEXT_EVENT_STREAM)
            .bodyValue(new TurnRequest("session-1", "user-1", "hello", null, null))
            .exchange()
            .expectStatus().isOk()
            .returnResult(TurnStreamEvent.class)
            .getResponseBody()
            .collectList()
            .block();

        assertNotNull(events);
        assertEquals(List.of("status", "content", "done"), events.stream().map(TurnStreamEvent::type).toList());
        assertEquals("turn-2", events.get(2).turnId());
    }

    @Test
    @DisplayName("health answers OK")
    void health() {
        client.get().uri("/api/v1/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
