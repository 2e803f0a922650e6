package com.companionagent.orchestrator.critique;

import com.companionagent.common.critique.CorrectionPromptFormatter;
import com.companionagent.common.model.PendingCorrection;
import com.companionagent.common.model.Severity;
import com.companionagent.orchestrator.model.PendingCorrectionRecord;
import com.companionagent.orchestrator.repository.PendingCorrectionRepository;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pending corrections: responses that failed asynchronous review, waiting to be addressed
 * by the next turn of their session. A correction is consumed at most once.
 */
@Service
public class SelfCorrectionService {

    private static final Logger log = LoggerFactory.getLogger(SelfCorrectionService.class);

    private static final TypeReference<List<String>> ISSUE_LIST = new TypeReference<>() {};

    /** Prompt block for the next turn and the ids it consumes. */
    public record CorrectionPrompt(String prompt, List<Long> correctionIds) {

        public static CorrectionPrompt none() {
            return new CorrectionPrompt(null, List.of());
        }
    }

    public record CorrectionStats(
        @JsonProperty("total")      long              total,
        @JsonProperty("bySeverity") Map<String, Long> bySeverity,
        @JsonProperty("pending")    long              pending
    ) {}

    private final PendingCorrectionRepository repository;
    private final ObjectMapper objectMapper;

    public SelfCorrectionService(PendingCorrectionRepository repository, ObjectMapper objectMapper) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
    }

    /** Unprocessed corrections, oldest first. A failed lookup answers an empty list. */
    public Mono<List<PendingCorrection>> getPendingCorrections(String sessionId) {
        return repository.findPending(sessionId)
            .map(this::toCorrection)
            .collectList()
            .onErrorResume(e -> {
                log.error("[SelfCorrection] Failed to load pending corrections. sessionId={} reason={}",
                          sessionId, e.getMessage());
                return Mono.just(List.of());
            });
    }

    /**
     * Every pending correction is returned in {@code correctionIds}, including minor ones
     * that produce no prompt text, so the delivering turn consumes all of them.
     */
    public Mono<CorrectionPrompt> getFormattedCorrectionPrompt(String sessionId) {
        return getPendingCorrections(sessionId)
            .map(corrections -> new CorrectionPrompt(
                CorrectionPromptFormatter.format(corrections),
                corrections.stream().map(PendingCorrection::id).toList()));
    }

    public Mono<Integer> markCorrectionsProcessed(List<Long> correctionIds) {
        if (correctionIds == null || correctionIds.isEmpty()) return Mono.just(0);
        return repository.markProcessed(correctionIds)
            .doOnNext(n -> log.debug("[SelfCorrection] Marked corrections processed. count={}", n));
    }

    public Mono<Integer> markAllSessionCorrectionsProcessed(String sessionId) {
        return repository.markAllProcessed(sessionId)
            .doOnNext(n -> log.info("[SelfCorrection] Dismissed session corrections. sessionId={} count={}", sessionId, n));
    }

    public Mono<PendingCorrectionRecord> createPendingCorrection(String sessionId, String userId, String turnId,
                                                                 Severity severity, List<String> issues,
                                                                 String fixInstructions, String originalResponse) {
        PendingCorrectionRecord record = new PendingCorrectionRecord();
        record.setSessionId(sessionId);
        record.setUserId(userId);
        record.setTurnId(turnId);
        record.setSeverity(severity.wire());
        record.setIssues(writeIssues(issues));
        record.setFixInstructions(fixInstructions);
        record.setOriginalResponse(originalResponse);
        record.setProcessed(false);
        record.setCreatedAt(LocalDateTime.now(ZoneOffset.UTC));
        return repository.save(record)
            .doOnNext(r -> log.info("[SelfCorrection] Pending correction created. sessionId={} turnId={} "
                                    + "severity={} issues={}", sessionId, turnId, severity.wire(), issues.size()));
    }

    public Mono<CorrectionStats> getCorrectionStats(String userId) {
        return repository.findByUserId(userId)
            .collectList()
            .map(rows -> {
                Map<String, Long> bySeverity = new LinkedHashMap<>();
                for (Severity s : Severity.values()) bySeverity.put(s.wire(), 0L);
                long pending = 0;
                for (PendingCorrectionRecord row : rows) {
                    bySeverity.merge(row.getSeverity(), 1L, Long::sum);
                    if (!Boolean.TRUE.equals(row.getProcessed())) pending++;
                }
                return new CorrectionStats(rows.size(), bySeverity, pending);
            });
    }

    /** Removes processed corrections older than {@code daysOld}. */
    public Mono<Integer> cleanupOldCorrections(int daysOld) {
        return repository.deleteProcessedBefore(LocalDateTime.now(ZoneOffset.UTC).minusDays(daysOld))
            .doOnNext(n -> {
                if (n > 0) log.info("[SelfCorrection] Cleaned up old corrections. deleted={} daysOld={}", n, daysOld);
            });
    }

    public Mono<Integer> deleteSessionCorrections(String sessionId) {
        return repository.deleteBySessionId(sessionId);
    }

    // ── mapping ─────────────────────────────────────────────────────────────

    PendingCorrection toCorrection(PendingCorrectionRecord r) {
        return new PendingCorrection(r.getId(), r.getSessionId(), r.getTurnId(),
            Severity.fromWire(r.getSeverity()), readIssues(r.getIssues()), r.getFixInstructions(),
            r.getOriginalResponse(), Boolean.TRUE.equals(r.getProcessed()));
    }

    private List<String> readIssues(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return objectMapper.readValue(json, ISSUE_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored correction issues are unreadable", e);
        }
    }

    private String writeIssues(List<String> issues) {
        try {
            return objectMapper.writeValueAsString(issues);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise correction issues", e);
        }
    }
}
