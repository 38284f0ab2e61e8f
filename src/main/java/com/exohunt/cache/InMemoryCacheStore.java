package com.exohunt.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory, thread-safe cache store.
 *
 * <p>Backed by a {@link ConcurrentHashMap} keyed on {@link CacheKey}. Reads are fully concurrent
 * and non-blocking. A disk or shared-cache adapter can replace it by implementing
 * {@link CacheStore}.
 */
@Repository
public class InMemoryCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheStore.class);

    private final ConcurrentMap<CacheKey, CacheEntry> store = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheEntry> get(CacheKey key) {
        return Optional.ofNullable(store.get(key));
    }

    /**
     * Save (or overwrite) an entry.
     */
    @Override
    public void put(CacheEntry entry) {
        store.put(entry.key(), entry);
        log.debug("Stored cache entry: key={} createdAt={}", entry.key(), entry.createdAt());
    }

    @Override
    public void remove(CacheKey key) {
        store.remove(key);
    }

    @Override
    public int removeCreatedBefore(Instant cutoff) {
        int before = store.size();
        store.values().removeIf(e -> e.createdAt().isBefore(cutoff));
        return before - store.size();
    }

    @Override
    public int size() {
        return store.size();
    }

    @Override
    public void clear() {
        store.clear();
    }
}
