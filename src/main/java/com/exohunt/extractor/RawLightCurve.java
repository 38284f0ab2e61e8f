package com.exohunt.extractor;

import com.exohunt.model.FluxType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Columns exactly as a format provider read them: unfiltered, unsorted, unnormalized.
 *
 * @param time         Observation times in days (may contain non-finite values)
 * @param fluxColumns  Flux columns present in the source, keyed by product
 * @param quality      Quality bitmask per row, null when the source has no quality column
 * @param metadata     Header key/value pairs with upper-cased keys (e.g., MISSION, KEPLERID)
 */
public record RawLightCurve(double[] time,
                            Map<FluxType, double[]> fluxColumns,
                            int[] quality,
                            Map<String, String> metadata) {

    public RawLightCurve {
        fluxColumns = fluxColumns.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(fluxColumns));
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean has(FluxType type) {
        return fluxColumns.containsKey(type);
    }

    public double[] flux(FluxType type) {
        return fluxColumns.get(type);
    }

    public Optional<String> meta(String key) {
        return Optional.ofNullable(metadata.get(key));
    }
}
