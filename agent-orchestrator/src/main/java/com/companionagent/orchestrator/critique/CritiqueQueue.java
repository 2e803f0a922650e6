package com.companionagent.orchestrator.critique;

import com.companionagent.common.model.CritiqueJob;
import com.companionagent.orchestrator.model.CritiqueJobLog;
import com.companionagent.orchestrator.repository.CritiqueJobLogRepository;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process background queue for critique jobs, backed by {@code critique_queue_log}.
 *
 * <p>Pipeline, started on {@code @PostConstruct}:
 * <pre>
 *   sink → admission limiter (rate-per-minute) → flatMap(worker, concurrency) with backoff retry
 * </pre>
 * A job is identified by its turn id: the in-flight set and the unique log row make
 * {@link #enqueue} idempotent. Rows left {@code queued} or {@code processing} by a previous
 * run are dispatched again at startup, so delivery is at least once.
 */
@Component
public class CritiqueQueue {

    private static final Logger log = LoggerFactory.getLogger(CritiqueQueue.class);

    /** Whether the queue accepts jobs, plus job counts by state read from the job log. */
    public record QueueStatus(
        @JsonProperty("enabled")   boolean enabled,
        @JsonProperty("waiting")   long waiting,
        @JsonProperty("active")    long active,
        @JsonProperty("completed") long completed,
        @JsonProperty("failed")    long failed
    ) {}

    private final CritiqueWorker worker;
    private final CritiqueJobLogRepository jobLog;
    private final ObjectMapper objectMapper;

    private final Sinks.Many<CritiqueJob> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicInteger active = new AtomicInteger();
    private volatile Disposable subscription;

    @Value("${critique.enabled:true}")
    private boolean enabled = true;

    @Value("${critique.concurrency:3}")
    private int concurrency = 3;

    @Value("${critique.rate-per-minute:10}")
    private int ratePerMinute = 10;

    @Value("${critique.max-attempts:2}")
    private int maxAttempts = 2;

    @Value("${critique.backoff-ms:1000}")
    private long backoffMs = 1000;

    @Value("${critique.drain-timeout-ms:10000}")
    private long drainTimeoutMs = 10_000;

    public CritiqueQueue(CritiqueWorker worker, CritiqueJobLogRepository jobLog, ObjectMapper objectMapper) {
        this.worker       = worker;
        this.jobLog       = jobLog;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("[CritiqueQueue] Disabled; turns will not be re-reviewed.");
            return;
        }
        AdmissionLimiter limiter = new AdmissionLimiter(ratePerMinute, Duration.ofMinutes(1), Clock.systemUTC());

        subscription = sink.asFlux()
            .concatMap(job -> Mono.delay(limiter.reserve()).thenReturn(job))
            .flatMap(this::run, concurrency)
            .subscribe();

        log.info("[CritiqueQueue] Started. concurrency={} ratePerMinute={} maxAttempts={} backoffMs={}",
                 concurrency, ratePerMinute, maxAttempts, backoffMs);
        recoverUnfinished();
    }

    @PreDestroy
    public void shutdown() {
        if (subscription == null) return;
        sink.tryEmitComplete();
        Flux.interval(Duration.ofMillis(100))
            .filter(tick -> active.get() == 0)
            .next()
            .timeout(Duration.ofMillis(drainTimeoutMs))
            .onErrorResume(e -> {
                log.warn("[CritiqueQueue] Drain timed out, abandoning in-flight jobs. active={}", active.get());
                return Mono.empty();
            })
            .block();
        subscription.dispose();
        log.info("[CritiqueQueue] Stopped.");
    }

    /**
     * Queues {@code job} once per turn id.
     *
     * @return {@code true} if queued by this call, {@code false} for a duplicate, a disabled
     *         queue or a failed write
     */
    public Mono<Boolean> enqueue(CritiqueJob job) {
        if (!enabled || subscription == null) {
            return Mono.just(false);
        }
        if (!inFlight.add(job.turnId())) {
            log.debug("[CritiqueQueue] Duplicate enqueue ignored (in flight). turnId={}", job.turnId());
            return Mono.just(false);
        }

        return jobLog.findByTurnId(job.turnId())
            .hasElement()
            .flatMap(exists -> {
                if (exists) {
                    inFlight.remove(job.turnId());
                    log.debug("[CritiqueQueue] Duplicate enqueue ignored (logged). turnId={}", job.turnId());
                    return Mono.just(false);
                }
                return Mono.fromCallable(() -> newLogRow(job))
                    .flatMap(jobLog::save)
                    .map(saved -> {
                        dispatch(job);
                        log.debug("[CritiqueQueue] Job queued. turnId={} sessionId={}", job.turnId(), job.sessionId());
                        return true;
                    });
            })
            .onErrorResume(DataIntegrityViolationException.class, e -> {
                inFlight.remove(job.turnId());
                log.debug("[CritiqueQueue] Duplicate enqueue ignored (concurrent). turnId={}", job.turnId());
                return Mono.just(false);
            })
            .onErrorResume(e -> {
                inFlight.remove(job.turnId());
                log.error("[CritiqueQueue] Failed to queue job. turnId={} reason={}", job.turnId(), e.getMessage());
                return Mono.just(false);
            });
    }

    public Mono<QueueStatus> status() {
        return Mono.zip(
                jobLog.countByStatus(CritiqueJobLog.QUEUED).defaultIfEmpty(0L),
                jobLog.countByStatus(CritiqueJobLog.PROCESSING).defaultIfEmpty(0L),
                jobLog.countByStatus(CritiqueJobLog.COMPLETED).defaultIfEmpty(0L),
                jobLog.countByStatus(CritiqueJobLog.FAILED).defaultIfEmpty(0L))
            .map(t -> new QueueStatus(isEnabled(), t.getT1(), t.getT2(), t.getT3(), t.getT4()));
    }

    public boolean isEnabled() {
        return enabled;
    }

    // ── worker side ─────────────────────────────────────────────────────────

    private Mono<Void> run(CritiqueJob job) {
        active.incrementAndGet();
        return Mono.defer(() -> worker.process(job))
            .retryWhen(Retry.backoff(Math.max(0, maxAttempts - 1), Duration.ofMillis(backoffMs))
                .doBeforeRetry(signal -> log.warn("[CritiqueQueue] Retrying job. turnId={} retry={} reason={}",
                    job.turnId(), signal.totalRetries() + 1, signal.failure().getMessage())))
            .onErrorResume(e -> {
                log.error("[CritiqueQueue] Job failed after {} attempt(s). turnId={} reason={}",
                          maxAttempts, job.turnId(), e.getMessage());
                return Mono.empty();
            })
            .doFinally(signal -> {
                active.decrementAndGet();
                inFlight.remove(job.turnId());
            })
            .then();
    }

    private void dispatch(CritiqueJob job) {
        Sinks.EmitResult result = sink.tryEmitNext(job);
        while (result == Sinks.EmitResult.FAIL_NON_SERIALIZED) {
            Thread.onSpinWait();
            result = sink.tryEmitNext(job);
        }
        if (result.isFailure()) {
            inFlight.remove(job.turnId());
            log.warn("[CritiqueQueue] Job not dispatched, stays queued for the next start. turnId={} result={}",
                     job.turnId(), result);
        }
    }

    private void recoverUnfinished() {
        jobLog.findUnfinished()
            .flatMap(row -> Mono.fromCallable(() -> objectMapper.readValue(row.getPayload(), CritiqueJob.class))
                .onErrorResume(e -> {
                    log.warn("[CritiqueQueue] Unreadable payload, marking failed. turnId={}", row.getTurnId());
                    row.setStatus(CritiqueJobLog.FAILED);
                    row.setCompletedAt(LocalDateTime.now(ZoneOffset.UTC));
                    return jobLog.save(row).then(Mono.<CritiqueJob>empty());
                }))
            .filter(job -> inFlight.add(job.turnId()))
            .doOnNext(this::dispatch)
            .count()
            .subscribe(
                n   -> { if (n > 0) log.info("[CritiqueQueue] Recovered unfinished jobs. count={}", n); },
                err -> log.warn("[CritiqueQueue] Recovery of unfinished jobs failed. reason={}", err.getMessage()));
    }

    private CritiqueJobLog newLogRow(CritiqueJob job) throws Exception {
        CritiqueJobLog row = new CritiqueJobLog();
        row.setTurnId(job.turnId());
        row.setSessionId(job.sessionId());
        row.setUserId(job.userId());
        row.setStatus(CritiqueJobLog.QUEUED);
        row.setPayload(objectMapper.writeValueAsString(job));
        row.setAttempts(0);
        row.setHintsWritten(false);
        row.setCreatedAt(LocalDateTime.now(ZoneOffset.UTC));
        return row;
    }
}
