package com.companionagent.orchestrator.controller;

import com.companionagent.common.model.AgentView;
import com.companionagent.orchestrator.critique.HintInjectionService;
import com.companionagent.orchestrator.critique.SelfCorrectionService;
import com.companionagent.orchestrator.model.AgentTurnRecord;
import com.companionagent.orchestrator.service.ChatTurnService;
import com.companionagent.orchestrator.state.EventLogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/sessions/{sessionId}")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private static final int MAX_TURNS = 100;

    private final ChatTurnService chatTurnService;
    private final HintInjectionService hintService;
    private final SelfCorrectionService correctionService;
    private final EventLogService eventLog;

    public SessionController(ChatTurnService chatTurnService, HintInjectionService hintService,
                             SelfCorrectionService correctionService, EventLogService eventLog) {
        this.chatTurnService   = chatTurnService;
        this.hintService       = hintService;
        this.correctionService = correctionService;
        this.eventLog          = eventLog;
    }

    @GetMapping("/view")
    public Mono<ResponseEntity<AgentView>> view(@PathVariable String sessionId) {
        return chatTurnService.sessionView(sessionId).map(ResponseEntity::ok);
    }

    @GetMapping("/turns")
    public Mono<ResponseEntity<List<AgentTurnRecord>>> turns(@PathVariable String sessionId,
                                                             @RequestParam(defaultValue = "10") int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_TURNS));
        return chatTurnService.recentTurns(sessionId, bounded).collectList().map(ResponseEntity::ok);
    }

    @DeleteMapping("/hints")
    public Mono<ResponseEntity<Map<String, Integer>>> clearHints(@PathVariable String sessionId) {
        return hintService.clearSessionHints(sessionId)
            .map(deleted -> ResponseEntity.ok(Map.of("deleted", deleted)));
    }

    /** Marks every pending correction of the session processed without injecting it. */
    @PostMapping("/corrections/dismiss")
    public Mono<ResponseEntity<Map<String, Integer>>> dismissCorrections(@PathVariable String sessionId) {
        return correctionService.markAllSessionCorrectionsProcessed(sessionId)
            .defaultIfEmpty(0)
            .map(dismissed -> ResponseEntity.ok(Map.of("dismissed", dismissed)));
    }

    /**
     * Drops the session's event log, session hints and corrections. User-scoped hints and the
     * turn log are kept.
     */
    @DeleteMapping
    public Mono<ResponseEntity<Map<String, Integer>>> reset(@PathVariable String sessionId) {
        return Mono.zip(
                eventLog.clear(sessionId).defaultIfEmpty(0),
                hintService.clearSessionHints(sessionId).defaultIfEmpty(0),
                correctionService.deleteSessionCorrections(sessionId).defaultIfEmpty(0))
            .map(t -> {
                Map<String, Integer> deleted = new LinkedHashMap<>();
                deleted.put("events", t.getT1());
                deleted.put("hints", t.getT2());
                deleted.put("corrections", t.getT3());
                log.info("[Session] Reset sessionId={} deleted={}", sessionId, deleted);
                return ResponseEntity.ok(deleted);
            });
    }
}
