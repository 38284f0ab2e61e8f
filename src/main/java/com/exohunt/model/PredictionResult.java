package com.exohunt.model;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Decoded classifier output.
 *
 * @param probabilities      Probability per class
 * @param predictedLabel     Class with the highest probability
 * @param confidence         Highest probability
 * @param inferenceDuration  Wall-clock time spent in input construction and inference
 * @param modelVersion       Version of the inference context that produced the result
 */
public record PredictionResult(Map<Classification, Double> probabilities,
                               Classification predictedLabel,
                               double confidence,
                               Duration inferenceDuration,
                               String modelVersion) {

    public PredictionResult {
        probabilities = Collections.unmodifiableMap(new EnumMap<>(probabilities));
    }

    public double probability(Classification classification) {
        return probabilities.getOrDefault(classification, 0.0);
    }
}
