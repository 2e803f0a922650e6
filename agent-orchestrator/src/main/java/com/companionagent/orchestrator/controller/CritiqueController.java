package com.companionagent.orchestrator.controller;

import com.companionagent.orchestrator.critique.CritiqueQueue;
import com.companionagent.orchestrator.critique.CritiqueQueue.QueueStatus;
import com.companionagent.orchestrator.critique.HintInjectionService;
import com.companionagent.orchestrator.critique.HintInjectionService.HintStats;
import com.companionagent.orchestrator.critique.SelfCorrectionService;
import com.companionagent.orchestrator.critique.SelfCorrectionService.CorrectionStats;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1")
public class CritiqueController {

    private final CritiqueQueue critiqueQueue;
    private final HintInjectionService hintService;
    private final SelfCorrectionService correctionService;

    public CritiqueController(CritiqueQueue critiqueQueue, HintInjectionService hintService,
                              SelfCorrectionService correctionService) {
        this.critiqueQueue     = critiqueQueue;
        this.hintService       = hintService;
        this.correctionService = correctionService;
    }

    @GetMapping("/critique/status")
    public Mono<ResponseEntity<QueueStatus>> status() {
        return critiqueQueue.status().map(ResponseEntity::ok);
    }

    @GetMapping("/users/{userId}/hints/stats")
    public Mono<ResponseEntity<HintStats>> hintStats(@PathVariable String userId) {
        return hintService.getUserHintStats(userId).map(ResponseEntity::ok);
    }

    @GetMapping("/users/{userId}/corrections/stats")
    public Mono<ResponseEntity<CorrectionStats>> correctionStats(@PathVariable String userId) {
        return correctionService.getCorrectionStats(userId).map(ResponseEntity::ok);
    }
}
