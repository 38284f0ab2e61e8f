package com.exohunt.cache;

/**
 * Pipeline stage whose output a cache entry holds.
 */
public enum CacheStage {
    /** Raw bytes fetched from the archive. */
    RAW,
    /** Extracted, normalized light curve. */
    SERIES,
    /** Fixed-length classifier input. */
    FEATURES
}
