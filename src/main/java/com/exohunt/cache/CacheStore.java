package com.exohunt.cache;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage medium behind {@link FeatureCache}. Implementations may throw
 * {@link CacheUnavailableException} (or any runtime exception) when the medium is down;
 * the cache treats that as a miss rather than failing the request.
 */
public interface CacheStore {

    Optional<CacheEntry> get(CacheKey key);

    void put(CacheEntry entry);

    void remove(CacheKey key);

    /**
     * Removes every entry created before {@code cutoff}; returns how many were removed.
     */
    int removeCreatedBefore(Instant cutoff);

    int size();

    void clear();
}
