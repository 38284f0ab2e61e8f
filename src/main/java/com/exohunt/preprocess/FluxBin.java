package com.exohunt.preprocess;

/**
 * Mutable accumulator for one time bin of the resampled sequence.
 *
 * Not thread-safe; a pipeline run owns its bins exclusively.
 */
class FluxBin {

    private double sum;
    private int count;

    /**
     * Incorporate one observation into this bin.
     */
    void add(double flux) {
        sum += flux;
        count++;
    }

    boolean isEmpty() {
        return count == 0;
    }

    /**
     * Mean of the accumulated flux, or {@code fallback} when the bin received no points.
     */
    double meanOr(double fallback) {
        return count == 0 ? fallback : sum / count;
    }
}
