package com.exohunt.cache;

/**
 * Point-in-time cache counters for health and diagnostics.
 */
public record CacheStats(int entries, long hits, long misses, long storeErrors, int inFlight) {
}
