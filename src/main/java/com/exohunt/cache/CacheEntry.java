package com.exohunt.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached pipeline output with its creation time.
 *
 * @param key        Content-addressed key
 * @param payload    Raw bytes, a light curve or a feature vector
 * @param createdAt  When the value was stored
 */
public record CacheEntry(CacheKey key, Object payload, Instant createdAt) {

    public CacheEntry {
        if (key == null) throw new IllegalArgumentException("Key must not be null");
        if (payload == null) throw new IllegalArgumentException("Payload must not be null");
        if (createdAt == null) throw new IllegalArgumentException("Creation time must not be null");
    }

    /**
     * An entry is stale once strictly more than {@code ttl} has passed since it was stored.
     */
    public boolean isStale(Instant now, Duration ttl) {
        return Duration.between(createdAt, now).compareTo(ttl) > 0;
    }
}
