package com.exohunt.model;

/**
 * Per-source outcome of a batch analysis.
 */
public record BatchItemResult(String sourceId, PredictionResult result, AnalysisError error) {

    public static BatchItemResult success(String sourceId, PredictionResult result) {
        return new BatchItemResult(sourceId, result, null);
    }

    public static BatchItemResult failure(String sourceId, AnalysisError error) {
        return new BatchItemResult(sourceId, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
