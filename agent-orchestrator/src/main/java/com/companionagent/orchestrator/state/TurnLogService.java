package com.companionagent.orchestrator.state;

import com.companionagent.common.model.PipelineState;
import com.companionagent.orchestrator.api.DriftMetrics;
import com.companionagent.orchestrator.model.AgentTurnRecord;
import com.companionagent.orchestrator.model.LlmCallRecord;
import com.companionagent.orchestrator.pipeline.LlmCall;
import com.companionagent.orchestrator.pipeline.TurnResult;
import com.companionagent.orchestrator.repository.AgentTurnRepository;
import com.companionagent.orchestrator.repository.AgentTurnRepository.DriftRow;
import com.companionagent.orchestrator.repository.LlmCallRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * One {@code agent_turns} row per delivered turn plus one {@code llm_calls} row per completed
 * model call. Writes are best effort.
 */
@Service
public class TurnLogService {

    private static final Logger log = LoggerFactory.getLogger(TurnLogService.class);

    private final AgentTurnRepository repository;
    private final LlmCallRepository llmCalls;
    private final ObjectMapper objectMapper;

    public TurnLogService(AgentTurnRepository repository, LlmCallRepository llmCalls, ObjectMapper objectMapper) {
        this.repository   = repository;
        this.llmCalls     = llmCalls;
        this.objectMapper = objectMapper;
    }

    public Mono<Void> record(TurnResult result, String userId, String delivered) {
        PipelineState state = result.state();
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        AgentTurnRecord record = new AgentTurnRecord();
        record.setTurnId(state.turnId());
        record.setSessionId(state.sessionId());
        record.setUserId(userId);
        record.setIdentityId(state.identity().id());
        record.setIdentityVersion(state.identity().version());
        record.setMode(state.mode().wire());
        record.setRoute(state.route().wire());
        record.setUserInput(state.userInput());
        record.setPlan(state.plan());
        record.setDraft(state.draft());
        record.setFinalOutput(delivered);
        record.setCritiquePassed(result.approved());
        record.setCritiqueIssues(toJson(state.critiqueIssues()));
        record.setAttempts(state.attempts());
        record.setInputTokens(result.inputTokens());
        record.setOutputTokens(result.outputTokens());
        record.setCacheTokens(result.cacheTokens());
        record.setLlmCallCount(result.llmCalls().size());
        record.setTotalCost(result.estimatedCost());
        record.setExecutionTimeMs(result.totalDurationMs());
        record.setCreatedAt(now);

        List<LlmCallRecord> calls = result.llmCalls().stream()
            .map(call -> toRecord(call, state, userId, now))
            .toList();

        return repository.save(record)
            .then(calls.isEmpty() ? Mono.<Void>empty() : llmCalls.saveAll(calls).then())
            .doOnSuccess(v -> log.debug("[TurnLog] Recorded turn. turnId={} llmCalls={} cost={}",
                state.turnId(), calls.size(), String.format("%.6f", result.estimatedCost())))
            .onErrorResume(e -> {
                log.warn("[TurnLog] Failed to record turn. turnId={} reason={}", state.turnId(), e.getMessage());
                return Mono.empty();
            });
    }

    public Flux<AgentTurnRecord> recent(String sessionId, int limit) {
        return repository.findRecent(sessionId, limit);
    }

    /**
     * Per day and identity version over {@code [from, to]} (UTC days, both inclusive), newest
     * day first. {@code identityId} narrows to one identity when not null.
     */
    public Flux<DriftMetrics> driftMetrics(LocalDate from, LocalDate to, String identityId) {
        LocalDateTime start = from.atStartOfDay();
        LocalDateTime end   = to.plusDays(1).atStartOfDay();
        Flux<DriftRow> rows = identityId == null
            ? repository.findDrift(start, end)
            : repository.findDriftForIdentity(start, end, identityId);
        return rows.map(TurnLogService::toDriftMetrics);
    }

    // ── mapping ─────────────────────────────────────────────────────────────

    static LlmCallRecord toRecord(LlmCall call, PipelineState state, String userId, LocalDateTime now) {
        LlmCallRecord record = new LlmCallRecord();
        record.setTurnId(state.turnId());
        record.setSessionId(state.sessionId());
        record.setUserId(userId);
        record.setNodeName(call.nodeName());
        record.setCallSequence(call.sequence());
        record.setProvider(call.usage().provider());
        record.setModel(call.usage().model());
        record.setInputTokens(call.usage().inputTokens());
        record.setOutputTokens(call.usage().outputTokens());
        record.setCacheTokens(call.usage().cacheTokens());
        record.setEstimatedCost(call.estimatedCost());
        record.setDurationMs(call.durationMs());
        record.setCreatedAt(now);
        return record;
    }

    static DriftMetrics toDriftMetrics(DriftRow row) {
        long total   = nz(row.totalTurns());
        long repairs = nz(row.repairTurns());
        double repairRate = total == 0 ? 0.0 : Math.round(repairs * 10_000.0 / total) / 100.0;
        double avgAttempts = row.avgAttempts() == null ? 0.0 : Math.round(row.avgAttempts() * 100) / 100.0;
        long avgMs = row.avgExecutionTimeMs() == null ? 0 : Math.round(row.avgExecutionTimeMs());
        return new DriftMetrics(row.metricDay(), row.identityId(),
            row.identityVersion() == null ? 0 : row.identityVersion(),
            total, repairs, repairRate, avgAttempts, nz(row.failedCritiques()), avgMs);
    }

    private static long nz(Long value) {
        return value == null ? 0 : value;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise critique issues", e);
        }
    }
}
