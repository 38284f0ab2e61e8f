package com.exohunt.model;

import com.exohunt.error.DataFormatException;

/**
 * Fixed-length flux sequence fed to the classifier's sequence branch.
 *
 * @param values        Resampled flux values; padded positions hold the neutral baseline 1.0
 * @param validityMask  {@code true} where the value comes from observed data
 * @param qualityScore  Fraction of valid positions
 * @param durationDays  Time span of the source series
 * @param gapsDetected  Gap count carried over from extraction
 * @param sourcePoints  Number of series points the vector was derived from
 */
public record FeatureVector(double[] values,
                            boolean[] validityMask,
                            double qualityScore,
                            double durationDays,
                            int gapsDetected,
                            int sourcePoints) {

    public FeatureVector {
        if (values == null || validityMask == null) throw new DataFormatException("Values and validity mask are required");
        if (values.length != validityMask.length) {
            throw new DataFormatException("Values and validity mask lengths differ");
        }
        if (qualityScore < 0.0 || qualityScore > 1.0) throw new DataFormatException("Quality score must be in [0, 1]");
        values = values.clone();
        validityMask = validityMask.clone();
    }

    public int length() {
        return values.length;
    }

    public int validCount() {
        int n = 0;
        for (boolean v : validityMask) if (v) n++;
        return n;
    }
}
