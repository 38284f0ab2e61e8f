package com.exohunt.cache;

import com.exohunt.model.FluxType;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content-addressed cache key: a SHA-256 over source identity, flux type, pipeline version and
 * stage. Uses a record for value equality so it is safe as a ConcurrentHashMap key.
 *
 * @param digest  Hex-encoded SHA-256
 * @param label   Human-readable description for logs; not part of equality
 */
public record CacheKey(String digest, String label) {

    public static CacheKey of(String sourceIdentity, FluxType fluxType, String pipelineVersion, CacheStage stage) {
        String flux = fluxType == null ? "-" : fluxType.name();
        String material = String.join("\u0000", sourceIdentity, flux, pipelineVersion, stage.name());
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(material.getBytes(StandardCharsets.UTF_8));
            return new CacheKey(HexFormat.of().formatHex(hash),
                    stage + ":" + sourceIdentity + ":" + flux + "@" + pipelineVersion);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CacheKey other && digest.equals(other.digest);
    }

    @Override
    public int hashCode() {
        return digest.hashCode();
    }

    @Override
    public String toString() {
        return label;
    }
}
