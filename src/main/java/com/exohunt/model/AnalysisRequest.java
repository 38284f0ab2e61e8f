package com.exohunt.model;

import com.exohunt.error.InvalidParameterException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * One light-curve source with its KOI tabular parameters.
 */
public record AnalysisRequest(LightCurveSource source, Map<String, Double> koiParams) {

    public AnalysisRequest {
        if (source == null) throw new InvalidParameterException("Source must not be null");
        // null values mean "not supplied", so Map.copyOf cannot be used
        koiParams = koiParams == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(koiParams));
    }
}
