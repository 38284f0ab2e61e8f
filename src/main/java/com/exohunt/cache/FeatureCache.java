package com.exohunt.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * TTL cache for expensive pipeline outputs (archive downloads, extracted light curves,
 * resampled feature vectors).
 *
 * <ul>
 *   <li>Entries older than the TTL are misses and are evicted on access</li>
 *   <li>{@link #getOrCompute} de-duplicates concurrent work per key through {@link SingleFlight}</li>
 *   <li>Store failures degrade to uncached operation; they never reach the caller</li>
 * </ul>
 */
@Component
public class FeatureCache {

    private static final Logger log = LoggerFactory.getLogger(FeatureCache.class);

    private final CacheStore store;
    private final Clock clock;
    private final Duration ttl;
    private final SingleFlight<CacheKey, Object> singleFlight = new SingleFlight<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong storeErrors = new AtomicLong();

    @Autowired
    public FeatureCache(CacheStore store,
                        Clock clock,
                        @Value("${exohunt.cache.ttl-hours:24}") long ttlHours) {
        this(store, clock, Duration.ofHours(ttlHours));
    }

    public FeatureCache(CacheStore store, Clock clock, Duration ttl) {
        this.store = store;
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Returns the cached value if present, fresh and of the requested type.
     */
    public <T> Optional<T> get(CacheKey key, Class<T> type) {
        Optional<CacheEntry> entry;
        try {
            entry = store.get(key);
        } catch (RuntimeException e) {
            storeErrors.incrementAndGet();
            log.warn("Cache store read failed for key={}, continuing uncached: {}", key, e.getMessage());
            misses.incrementAndGet();
            return Optional.empty();
        }

        if (entry.isEmpty()) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        CacheEntry e = entry.get();
        if (e.isStale(clock.instant(), ttl)) {
            log.debug("Evicting stale cache entry: key={} createdAt={}", key, e.createdAt());
            safeRemove(key);
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (!type.isInstance(e.payload())) {
            log.warn("Cache entry for key={} holds {} but {} was requested; treating as miss",
                    key, e.payload().getClass().getSimpleName(), type.getSimpleName());
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(type.cast(e.payload()));
    }

    /**
     * Stores a value stamped with the current time.
     */
    public void put(CacheKey key, Object value) {
        try {
            store.put(new CacheEntry(key, value, clock.instant()));
        } catch (RuntimeException e) {
            storeErrors.incrementAndGet();
            log.warn("Cache store write failed for key={}, result not cached: {}", key, e.getMessage());
        }
    }

    /**
     * Returns the cached value or computes, stores and returns it. Concurrent callers for the same
     * missing key share one computation; its exception, if any, propagates to all of them and
     * nothing is cached.
     */
    public <T> T getOrCompute(CacheKey key, Class<T> type, Supplier<T> computation) {
        Optional<T> cached = get(key, type);
        if (cached.isPresent()) return cached.get();

        Object value = singleFlight.execute(key, () -> {
            // another flight may have finished between our miss and registration
            Optional<T> again = get(key, type);
            if (again.isPresent()) return again.get();
            T computed = computation.get();
            put(key, computed);
            return computed;
        });
        return type.cast(value);
    }

    /**
     * Scheduled housekeeping: drops expired entries. Freshness never depends on it.
     */
    @Scheduled(fixedRateString = "${exohunt.cache.sweep-interval-ms:600000}",
            initialDelayString = "${exohunt.cache.sweep-interval-ms:600000}")
    public void purgeExpired() {
        try {
            int removed = store.removeCreatedBefore(clock.instant().minus(ttl));
            if (removed > 0) log.info("Cache sweep removed {} expired entries", removed);
        } catch (RuntimeException e) {
            storeErrors.incrementAndGet();
            log.warn("Cache sweep failed: {}", e.getMessage());
        }
    }

    /**
     * Removes entries older than {@code maxAge}, regardless of the configured TTL.
     */
    public int purgeOlderThan(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        return store.removeCreatedBefore(cutoff);
    }

    public void clear() {
        store.clear();
        log.info("Cache cleared");
    }

    public CacheStats stats() {
        int entries;
        try {
            entries = store.size();
        } catch (RuntimeException e) {
            storeErrors.incrementAndGet();
            entries = -1;
        }
        return new CacheStats(entries, hits.get(), misses.get(), storeErrors.get(), singleFlight.inFlightCount());
    }

    public Duration getTtl() {
        return ttl;
    }

    private void safeRemove(CacheKey key) {
        try {
            store.remove(key);
        } catch (RuntimeException e) {
            storeErrors.incrementAndGet();
            log.warn("Cache store eviction failed for key={}: {}", key, e.getMessage());
        }
    }
}
