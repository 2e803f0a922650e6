package com.companionagent.orchestrator.critique;

import com.companionagent.common.critique.HintPromptFormatter;
import com.companionagent.common.critique.HintWeightPolicy;
import com.companionagent.common.model.Hint;
import com.companionagent.common.model.HintScope;
import com.companionagent.orchestrator.model.SessionHintRecord;
import com.companionagent.orchestrator.model.UserHintRecord;
import com.companionagent.orchestrator.repository.SessionHintRepository;
import com.companionagent.orchestrator.repository.UserHintRepository;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Stores hints learned from critique and renders the active ones for the generator.
 *
 * <p>Session hints are insert-or-ignore per {@code (session, type)} and always weigh 1.0.
 * User hints are upserted per {@code (user, type)}: each recurrence bumps the occurrence
 * count and raises the weight by {@link HintWeightPolicy#STEP}, capped at
 * {@link HintWeightPolicy#MAX_WEIGHT}. Weights only go down through {@link #decayUserHints}.
 */
@Service
public class HintInjectionService {

    private static final Logger log = LoggerFactory.getLogger(HintInjectionService.class);

    static final int SESSION_HINT_LIMIT = 10;
    static final int USER_HINT_LIMIT    = 5;
    static final int STATS_LIMIT        = 10;
    static final int STATS_TOP          = 5;

    public record TopHint(
        @JsonProperty("type")        String type,
        @JsonProperty("occurrences") int    occurrences,
        @JsonProperty("weight")      double weight
    ) {}

    public record HintStats(
        @JsonProperty("totalHints") int           totalHints,
        @JsonProperty("avgWeight")  double        avgWeight,
        @JsonProperty("topHints")   List<TopHint> topHints
    ) {}

    private final SessionHintRepository sessionHints;
    private final UserHintRepository userHints;

    public HintInjectionService(SessionHintRepository sessionHints, UserHintRepository userHints) {
        this.sessionHints = sessionHints;
        this.userHints    = userHints;
    }

    // ── retrieval ───────────────────────────────────────────────────────────

    /**
     * Tuning block for the next draft, or empty when there is nothing to inject.
     * Lookup failures are logged and treated as "no hints".
     */
    public Mono<String> getFormattedHints(String sessionId, String userId) {
        Mono<List<Hint>> session = sessionHints.findRecent(sessionId, SESSION_HINT_LIMIT)
            .map(r -> Hint.session(r.getHintType(), r.getHintText(), toInstant(r.getCreatedAt())))
            .collectList();
        Mono<List<Hint>> user = userId == null
            ? Mono.just(List.of())
            : userHints.findInjectable(userId, HintWeightPolicy.INJECT_MIN, USER_HINT_LIMIT)
                .map(HintInjectionService::toHint)
                .collectList();

        return Mono.zip(session, user)
            .flatMap(t -> Mono.justOrEmpty(HintPromptFormatter.format(t.getT1(), t.getT2())))
            .doOnNext(block -> log.debug("[Hints] Injecting hints. sessionId={} userId={} lines={}",
                sessionId, userId, block.split("\n").length - 1))
            .onErrorResume(e -> {
                log.warn("[Hints] Hint lookup failed, continuing without hints. sessionId={} reason={}",
                         sessionId, e.getMessage());
                return Mono.empty();
            });
    }

    // ── writes ──────────────────────────────────────────────────────────────

    /** Inserts the hint unless the session already has one of that type. */
    public Mono<Boolean> saveSessionHint(String sessionId, String hintType, String hintText) {
        return sessionHints.findBySessionIdAndHintType(sessionId, hintType)
            .hasElement()
            .flatMap(exists -> {
                if (exists) return Mono.just(false);
                SessionHintRecord record = new SessionHintRecord();
                record.setSessionId(sessionId);
                record.setHintType(hintType);
                record.setHintText(hintText);
                record.setWeight(HintWeightPolicy.INITIAL_WEIGHT);
                record.setCreatedAt(LocalDateTime.now(ZoneOffset.UTC));
                return sessionHints.save(record)
                    .thenReturn(true)
                    .onErrorResume(DataIntegrityViolationException.class, e -> Mono.just(false));
            });
    }

    /**
     * Creates the user hint at weight 1.0, or reinforces the existing one. A concurrent
     * insert of the same {@code (user, type)} is retried once as a reinforcement.
     */
    public Mono<UserHintRecord> upsertUserHint(String userId, String hintType, String hintText) {
        return upsertOnce(userId, hintType, hintText)
            .onErrorResume(DataIntegrityViolationException.class, e -> {
                log.debug("[Hints] Concurrent user hint insert, retrying. userId={} type={}", userId, hintType);
                return upsertOnce(userId, hintType, hintText);
            });
    }

    private Mono<UserHintRecord> upsertOnce(String userId, String hintType, String hintText) {
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        return userHints.findByUserIdAndHintType(userId, hintType)
            .flatMap(existing -> {
                existing.setOccurrenceCount(existing.getOccurrenceCount() + 1);
                existing.setWeight(HintWeightPolicy.reinforce(existing.getWeight()));
                existing.setLastSeen(now);
                return userHints.save(existing);
            })
            .switchIfEmpty(Mono.defer(() -> {
                UserHintRecord record = new UserHintRecord();
                record.setUserId(userId);
                record.setHintType(hintType);
                record.setHintText(hintText);
                record.setWeight(HintWeightPolicy.INITIAL_WEIGHT);
                record.setOccurrenceCount(1);
                record.setLastSeen(now);
                record.setCreatedAt(now);
                return userHints.save(record);
            }));
    }

    public Mono<Integer> clearSessionHints(String sessionId) {
        return sessionHints.deleteBySessionId(sessionId)
            .doOnNext(n -> log.info("[Hints] Session hints cleared. sessionId={} deleted={}", sessionId, n));
    }

    // ── stats / maintenance ─────────────────────────────────────────────────

    /** Over the user's 10 most frequent hints: count, mean weight and the top 5. */
    public Mono<HintStats> getUserHintStats(String userId) {
        return userHints.findMostFrequent(userId, STATS_LIMIT)
            .collectList()
            .map(hints -> {
                double avg = hints.stream().mapToDouble(UserHintRecord::getWeight).average().orElse(0.0);
                List<TopHint> top = hints.stream()
                    .limit(STATS_TOP)
                    .map(h -> new TopHint(h.getHintType(), h.getOccurrenceCount(), round2(h.getWeight())))
                    .toList();
                return new HintStats(hints.size(), round2(avg), top);
            });
    }

    /**
     * Applies {@link HintWeightPolicy#decay} to every user hint not seen for a day, then
     * deletes hints below {@link HintWeightPolicy#PRUNE_BELOW}.
     *
     * @return number of hints whose weight changed
     */
    public Mono<Integer> decayUserHints(int decayDays) {
        Instant now = Instant.now();
        return userHints.findSeenBefore(LocalDateTime.ofInstant(now.minusSeconds(86_400), ZoneOffset.UTC))
            .concatMap(hint -> {
                double decayed = HintWeightPolicy.decay(hint.getWeight(), toInstant(hint.getLastSeen()), now, decayDays);
                if (decayed == hint.getWeight()) return Mono.<UserHintRecord>empty();
                hint.setWeight(decayed);
                return userHints.save(hint);
            })
            .count()
            .map(Long::intValue)
            .flatMap(updated -> userHints.deleteWeakerThan(HintWeightPolicy.PRUNE_BELOW)
                .doOnNext(pruned -> {
                    if (updated > 0 || pruned > 0) {
                        log.info("[Hints] Decayed user hint weights. updated={} pruned={} decayDays={}",
                                 updated, pruned, decayDays);
                    }
                })
                .thenReturn(updated));
    }

    // ── mapping ─────────────────────────────────────────────────────────────

    private static Hint toHint(UserHintRecord r) {
        return new Hint(HintScope.USER, r.getHintType(), r.getHintText(), r.getWeight(),
                        r.getOccurrenceCount(), toInstant(r.getLastSeen()));
    }

    private static Instant toInstant(LocalDateTime time) {
        return time == null ? null : time.toInstant(ZoneOffset.UTC);
    }

    private static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
