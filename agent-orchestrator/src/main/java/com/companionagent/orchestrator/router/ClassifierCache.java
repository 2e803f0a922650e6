package com.companionagent.orchestrator.router;

import com.companionagent.common.model.IntentClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Remote classifier results shared across concurrent turns, keyed by the normalised message.
 *
 * <p>Entries are written once per key and expire after {@link #TTL}. Expired entries are
 * treated as misses on read; a best-effort sweep removes them, triggered with probability
 * {@link #SWEEP_PROBABILITY} on each routing call. Eviction timing never affects routing.
 */
@Component
public class ClassifierCache {

    private static final Logger log = LoggerFactory.getLogger(ClassifierCache.class);

    static final Duration TTL               = Duration.ofMinutes(5);
    static final double   SWEEP_PROBABILITY = 0.1;
    static final int      MAX_KEY_LENGTH    = 200;

    record Entry(IntentClass intentClass, Instant cachedAt) {}

    private final ConcurrentHashMap<String, Entry> store = new ConcurrentHashMap<>();
    private final Clock clock;
    private final DoubleSupplier random;

    public ClassifierCache() {
        this(Clock.systemUTC(), () -> ThreadLocalRandom.current().nextDouble());
    }

    ClassifierCache(Clock clock, DoubleSupplier random) {
        this.clock  = clock;
        this.random = random;
    }

    /** Lower-cased, trimmed, first 200 characters. */
    public static String key(String message) {
        String normalised = message == null ? "" : message.toLowerCase().trim();
        return normalised.length() > MAX_KEY_LENGTH ? normalised.substring(0, MAX_KEY_LENGTH) : normalised;
    }

    /** Cached class, or {@code null} when absent or expired. */
    public IntentClass get(String message) {
        String key = key(message);
        Entry entry = store.get(key);
        if (entry == null) return null;
        if (isExpired(entry)) {
            store.remove(key, entry);
            return null;
        }
        log.debug("[ClassifierCache] hit key={}", key.length() > 50 ? key.substring(0, 50) : key);
        return entry.intentClass();
    }

    public void put(String message, IntentClass intentClass) {
        store.put(key(message), new Entry(intentClass, clock.instant()));
    }

    /** Runs {@link #sweep()} with probability {@link #SWEEP_PROBABILITY}. */
    public void maybeSweep() {
        if (random.getAsDouble() < SWEEP_PROBABILITY) {
            sweep();
        }
    }

    public int sweep() {
        int before = store.size();
        store.entrySet().removeIf(e -> isExpired(e.getValue()));
        int removed = before - store.size();
        if (removed > 0) {
            log.debug("[ClassifierCache] sweep removed={} remaining={}", removed, store.size());
        }
        return removed;
    }

    public int size() {
        return store.size();
    }

    private boolean isExpired(Entry entry) {
        return clock.instant().isAfter(entry.cachedAt().plus(TTL));
    }
}
