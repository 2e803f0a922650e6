package com.companionagent.orchestrator.critique;

import com.companionagent.orchestrator.model.CritiqueJobLog;
import com.companionagent.orchestrator.repository.CritiqueJobLogRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.function.Supplier;

/**
 * Housekeeping for the critique feedback loop, each on its own self-rescheduling loop:
 * <pre>
 *   retention   delay(retention-interval) → drop old completed/failed job rows → repeat
 *   feedback    delay(decay-interval)     → decay user hints, drop old corrections → repeat
 * </pre>
 * A failed cycle is logged and the loop reschedules with the same interval.
 */
@Component
public class CritiqueMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(CritiqueMaintenanceScheduler.class);

    private final CritiqueJobLogRepository jobLog;
    private final HintInjectionService hintService;
    private final SelfCorrectionService correctionService;

    @Value("${critique.maintenance.enabled:true}")
    private boolean enabled = true;

    @Value("${critique.retention.completed-ms:3600000}")
    private long completedRetentionMs = 3_600_000;

    @Value("${critique.retention.failed-ms:86400000}")
    private long failedRetentionMs = 86_400_000;

    @Value("${critique.maintenance.retention-interval-ms:600000}")
    private long retentionIntervalMs = 600_000;

    @Value("${hints.decay-interval-ms:86400000}")
    private long decayIntervalMs = 86_400_000;

    @Value("${hints.decay-days:7}")
    private int decayDays = 7;

    @Value("${corrections.retention-days:7}")
    private int correctionRetentionDays = 7;

    public CritiqueMaintenanceScheduler(CritiqueJobLogRepository jobLog, HintInjectionService hintService,
                                        SelfCorrectionService correctionService) {
        this.jobLog            = jobLog;
        this.hintService       = hintService;
        this.correctionService = correctionService;
    }

    @PostConstruct
    public void startMaintenance() {
        if (!enabled) {
            log.info("[Maintenance] Disabled.");
            return;
        }
        log.info("[Maintenance] Started. retentionIntervalMs={} decayIntervalMs={} decayDays={}",
                 retentionIntervalMs, decayIntervalMs, decayDays);
        scheduleNext("retention", Duration.ofMillis(retentionIntervalMs), this::sweepJobLog);
        scheduleNext("feedback", Duration.ofMillis(decayIntervalMs), this::maintainFeedback);
    }

    private void scheduleNext(String loop, Duration interval, Supplier<Mono<?>> cycle) {
        Mono.delay(interval)
            .then(Mono.defer(cycle))
            .then()
            .subscribe(
                unused -> { },
                err -> {
                    log.error("[Maintenance] Cycle failed. loop={} reason={}", loop, err.getMessage());
                    scheduleNext(loop, interval, cycle);
                },
                () -> scheduleNext(loop, interval, cycle)
            );
    }

    /** Deletes completed rows older than an hour and failed rows older than a day. */
    Mono<Integer> sweepJobLog() {
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        return jobLog.deleteFinishedBefore(CritiqueJobLog.COMPLETED, now.minus(Duration.ofMillis(completedRetentionMs)))
            .zipWith(jobLog.deleteFinishedBefore(CritiqueJobLog.FAILED, now.minus(Duration.ofMillis(failedRetentionMs))))
            .map(t -> {
                if (t.getT1() + t.getT2() > 0) {
                    log.info("[Maintenance] Job log swept. completedDeleted={} failedDeleted={}", t.getT1(), t.getT2());
                }
                return t.getT1() + t.getT2();
            });
    }

    Mono<Integer> maintainFeedback() {
        return hintService.decayUserHints(decayDays)
            .then(correctionService.cleanupOldCorrections(correctionRetentionDays));
    }
}
