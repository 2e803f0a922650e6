package com.companionagent.orchestrator.controller;

import com.companionagent.orchestrator.api.DriftMetrics;
import com.companionagent.orchestrator.state.TurnLogService;
import com.companionagent.orchestrator.usage.TokenUsageService;
import com.companionagent.orchestrator.usage.TokenUsageService.DailyTokenStats;
import com.companionagent.orchestrator.usage.TokenUsageService.TurnTokenSummary;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/** Token/cost usage and identity drift read from the turn logs. */
@RestController
@RequestMapping("/api/v1")
public class MetricsController {

    private static final int MAX_TURNS          = 200;
    private static final int DEFAULT_DRIFT_DAYS = 7;

    private final TokenUsageService tokenUsage;
    private final TurnLogService turnLog;

    public MetricsController(TokenUsageService tokenUsage, TurnLogService turnLog) {
        this.tokenUsage = tokenUsage;
        this.turnLog    = turnLog;
    }

    @GetMapping("/turns/{turnId}/tokens")
    public Mono<ResponseEntity<TurnTokenSummary>> turnTokens(@PathVariable String turnId) {
        return tokenUsage.getTurnSummary(turnId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/sessions/{sessionId}/tokens")
    public Mono<ResponseEntity<List<TurnTokenSummary>>> sessionTokens(@PathVariable String sessionId,
                                                                      @RequestParam(defaultValue = "50") int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_TURNS));
        return tokenUsage.getSessionTurnStats(sessionId, bounded).collectList().map(ResponseEntity::ok);
    }

    @GetMapping("/users/{userId}/tokens/daily")
    public Mono<ResponseEntity<DailyTokenStats>> dailyTokens(@PathVariable String userId) {
        return tokenUsage.getDailyTurnStats(userId).map(ResponseEntity::ok);
    }

    /** Defaults to the last 7 UTC days including today. */
    @GetMapping("/metrics/drift")
    public Mono<ResponseEntity<List<DriftMetrics>>> drift(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false) String identityId) {
        LocalDate end   = to != null ? to : LocalDate.now(ZoneOffset.UTC);
        LocalDate start = from != null ? from : end.minusDays(DEFAULT_DRIFT_DAYS - 1);
        if (start.isAfter(end)) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return turnLog.driftMetrics(start, end, identityId).collectList().map(ResponseEntity::ok);
    }
}
