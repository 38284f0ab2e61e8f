package com.exohunt.inference;

/**
 * Everything one prediction needs from the model side. Immutable: switching models means
 * building a new context, never changing one that calls may be using.
 *
 * @param modelVersion    Version tag reported with each prediction
 * @param scaler          Standardization table for the tabular branch
 * @param classifier      The frozen classifier
 * @param sequenceLength  Sequence length the classifier was trained on
 */
public record InferenceContext(String modelVersion,
                               ScalerTable scaler,
                               TabularClassifier classifier,
                               int sequenceLength) {

    public InferenceContext {
        if (modelVersion == null || modelVersion.isBlank()) throw new IllegalArgumentException("Model version is required");
        if (scaler == null) throw new IllegalArgumentException("Scaler table is required");
        if (classifier == null) throw new IllegalArgumentException("Classifier is required");
        if (sequenceLength <= 0) throw new IllegalArgumentException("Sequence length must be positive");
    }

    public InferenceContext withClassifier(String version, TabularClassifier replacement) {
        return new InferenceContext(version, scaler, replacement, sequenceLength);
    }
}
