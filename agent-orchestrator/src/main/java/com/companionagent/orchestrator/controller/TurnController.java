package com.companionagent.orchestrator.controller;

import com.companionagent.orchestrator.api.TurnRequest;
import com.companionagent.orchestrator.api.TurnResponse;
import com.companionagent.orchestrator.api.TurnStreamEvent;
import com.companionagent.orchestrator.service.ChatTurnService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1")
public class TurnController {

    private final ChatTurnService chatTurnService;

    public TurnController(ChatTurnService chatTurnService) {
        this.chatTurnService = chatTurnService;
    }

    @PostMapping("/turns")
    public Mono<ResponseEntity<TurnResponse>> turn(@RequestBody TurnRequest request) {
        if (isInvalid(request)) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return chatTurnService.processTurn(request).map(ResponseEntity::ok);
    }

    @PostMapping(value = "/turns/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<TurnStreamEvent> stream(@RequestBody TurnRequest request) {
        if (isInvalid(request)) {
            return Flux.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "sessionId and message are required"));
        }
        return chatTurnService.streamTurn(request);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static boolean isInvalid(TurnRequest request) {
        return request == null
            || request.sessionId() == null || request.sessionId().isBlank()
            || request.message() == null || request.message().isBlank();
    }
}
