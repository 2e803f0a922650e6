package com.companionagent.orchestrator.critique;

import com.companionagent.common.critique.CritiqueEventPublisher;
import com.companionagent.common.critique.HintTaxonomy;
import com.companionagent.common.exception.PipelineException;
import com.companionagent.common.exception.PipelineException.FailureKind;
import com.companionagent.common.identity.IdentityProfile;
import com.companionagent.common.model.AgentView;
import com.companionagent.common.model.CritiqueJob;
import com.companionagent.common.model.CritiqueJobResult;
import com.companionagent.common.model.CritiqueReviewNotification;
import com.companionagent.common.model.PipelineState;
import com.companionagent.common.model.Severity;
import com.companionagent.common.model.SupervisorVerdict;
import com.companionagent.orchestrator.identity.IdentityService;
import com.companionagent.orchestrator.model.CritiqueJobLog;
import com.companionagent.orchestrator.pipeline.SupervisorNode;
import com.companionagent.orchestrator.repository.CritiqueJobLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one critique job: re-reviews a delivered response against the identity version that
 * was pinned when it was produced, then feeds the findings back as hints and a pending
 * correction.
 *
 * <p>Hint writes are best effort per issue and happen once per turn: the job row records
 * them, and a retried job only reports the hint types. Any other failure marks the job row
 * {@code failed} and propagates so the queue can retry.
 */
@Component
public class CritiqueWorker {

    private static final Logger log = LoggerFactory.getLogger(CritiqueWorker.class);

    private final IdentityService identityService;
    private final SupervisorNode supervisor;
    private final HintInjectionService hintService;
    private final SelfCorrectionService correctionService;
    private final CritiqueEventPublisher eventPublisher;
    private final CritiqueJobLogRepository jobLog;
    private final ObjectMapper objectMapper;

    public CritiqueWorker(IdentityService identityService, SupervisorNode supervisor,
                          HintInjectionService hintService, SelfCorrectionService correctionService,
                          CritiqueEventPublisher eventPublisher, CritiqueJobLogRepository jobLog,
                          ObjectMapper objectMapper) {
        this.identityService   = identityService;
        this.supervisor        = supervisor;
        this.hintService       = hintService;
        this.correctionService = correctionService;
        this.eventPublisher    = eventPublisher;
        this.jobLog            = jobLog;
        this.objectMapper      = objectMapper;
    }

    public Mono<CritiqueJobResult> process(CritiqueJob job) {
        return Mono.defer(() -> {
            long startedAt = System.currentTimeMillis();
            log.debug("[CritiqueWorker] Processing job. turnId={} sessionId={}", job.turnId(), job.sessionId());

            return markProcessing(job)
                .flatMap(hintsWritten -> identityService.getIdentity(job.identityId(), job.identityVersion())
                    .switchIfEmpty(Mono.error(() -> new PipelineException("CritiqueWorker",
                        FailureKind.QUEUE_JOB_FAILURE,
                        "Identity not found: " + job.identityId() + "@" + job.identityVersion())))
                    .flatMap(identity -> supervisor.review(reviewState(job, identity))
                        .flatMap(supervised -> applyFindings(job, identity, supervised.verdict(),
                                                             hintsWritten, startedAt))))
                .onErrorResume(e -> markFailed(job, e).then(Mono.error(e)));
        });
    }

    private Mono<CritiqueJobResult> applyFindings(CritiqueJob job, IdentityProfile identity,
                                                  SupervisorVerdict verdict, boolean hintsWritten,
                                                  long startedAt) {
        List<String> issues = verdict.issues();
        Severity severity = Severity.fromIssueCount(issues.size());

        Mono<Void> correction = (!verdict.approved() && !issues.isEmpty())
            ? correctionService.createPendingCorrection(job.sessionId(), job.userId(), job.turnId(), severity,
                                                        issues, verdict.fixInstructions(), job.draft()).then()
            : Mono.empty();

        Mono<List<String>> hints;
        if (hintsWritten) {
            log.info("[CritiqueWorker] Hints written by an earlier attempt, skipping. turnId={}", job.turnId());
            hints = Mono.fromSupplier(() -> hintTypes(issues));
        } else {
            hints = generateHints(job, issues).flatMap(types -> markHintsWritten(job).thenReturn(types));
        }

        return hints
            .flatMap(types -> correction.thenReturn(new CritiqueJobResult(
                verdict.approved(), issues, verdict.fixInstructions(), severity, types)))
            .doOnNext(result -> eventPublisher.publish(
                CritiqueReviewNotification.of(identity.traits().name(), job, result)))
            .flatMap(result -> markCompleted(job, result, System.currentTimeMillis() - startedAt)
                .thenReturn(result))
            .doOnNext(result -> log.info("[CritiqueWorker] Job completed. turnId={} approved={} issues={} "
                                         + "severity={} hints={} timeMs={}",
                job.turnId(), result.approved(), result.issues().size(), severity.wire(),
                result.hintsGenerated(), System.currentTimeMillis() - startedAt));
    }

    /** One hint per matching issue, in issue order; a failed save is logged and skipped. */
    private Mono<List<String>> generateHints(CritiqueJob job, List<String> issues) {
        return Flux.fromIterable(issues)
            .concatMap(issue -> {
                HintTaxonomy.HintType hint = HintTaxonomy.classify(issue);
                if (hint == null) return Mono.<String>empty();
                Mono<Void> userHint = job.userId() == null
                    ? Mono.empty()
                    : hintService.upsertUserHint(job.userId(), hint.type(), hint.text()).then();
                return hintService.saveSessionHint(job.sessionId(), hint.type(), hint.text())
                    .then(userHint)
                    .thenReturn(hint.type())
                    .onErrorResume(e -> {
                        log.warn("[CritiqueWorker] Failed to save hint. turnId={} type={} reason={}",
                                 job.turnId(), hint.type(), e.getMessage());
                        return Mono.just(hint.type());
                    });
            })
            .collectList();
    }

    static List<String> hintTypes(List<String> issues) {
        return issues.stream()
            .map(HintTaxonomy::classify)
            .filter(Objects::nonNull)
            .map(HintTaxonomy.HintType::type)
            .toList();
    }

    /** Same shape as a live turn at review time, minus view, memories and prior attempts. */
    static PipelineState reviewState(CritiqueJob job, IdentityProfile identity) {
        return new PipelineState(job.sessionId(), job.turnId(), job.userInput(), job.mode(), identity, null,
            AgentView.empty(), List.of(), job.plan(), job.draft(), List.of(), 0, null, Instant.now(),
            null, null);
    }

    // ── job log ─────────────────────────────────────────────────────────────

    /** @return whether an earlier attempt already wrote this turn's hints */
    private Mono<Boolean> markProcessing(CritiqueJob job) {
        return jobLog.findByTurnId(job.turnId())
            .flatMap(row -> {
                row.setStatus(CritiqueJobLog.PROCESSING);
                row.setAttempts(row.getAttempts() == null ? 1 : row.getAttempts() + 1);
                return jobLog.save(row);
            })
            .map(row -> Boolean.TRUE.equals(row.getHintsWritten()))
            .defaultIfEmpty(false);
    }

    private Mono<Void> markHintsWritten(CritiqueJob job) {
        return jobLog.findByTurnId(job.turnId())
            .flatMap(row -> {
                row.setHintsWritten(true);
                return jobLog.save(row);
            })
            .then();
    }

    private Mono<Void> markCompleted(CritiqueJob job, CritiqueJobResult result, long processingTimeMs) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("approved", result.approved());
        summary.put("issues", result.issues());
        summary.put("severity", result.severity().wire());
        return jobLog.findByTurnId(job.turnId())
            .flatMap(row -> {
                row.setStatus(CritiqueJobLog.COMPLETED);
                row.setResult(toJson(summary));
                row.setProcessingTimeMs(processingTimeMs);
                row.setCompletedAt(LocalDateTime.now(ZoneOffset.UTC));
                return jobLog.save(row);
            })
            .then();
    }

    private Mono<Void> markFailed(CritiqueJob job, Throwable error) {
        log.error("[CritiqueWorker] Job failed. turnId={} reason={}", job.turnId(), error.getMessage());
        return jobLog.findByTurnId(job.turnId())
            .flatMap(row -> {
                row.setStatus(CritiqueJobLog.FAILED);
                row.setResult(toJson(Map.of("error", String.valueOf(error.getMessage()))));
                row.setCompletedAt(LocalDateTime.now(ZoneOffset.UTC));
                return jobLog.save(row);
            })
            .then()
            .onErrorResume(e -> {
                log.warn("[CritiqueWorker] Could not record failure. turnId={} reason={}", job.turnId(), e.getMessage());
                return Mono.empty();
            });
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise job result", e);
        }
    }
}
