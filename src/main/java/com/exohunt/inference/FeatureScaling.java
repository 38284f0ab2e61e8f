package com.exohunt.inference;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Standardization parameters of one tabular feature.
 *
 * @param mean          Training-set mean
 * @param std           Training-set standard deviation; 0 is treated as 1
 * @param defaultValue  Raw value used when the caller omits the feature, or null if it is required
 */
public record FeatureScaling(@JsonProperty("mean") double mean,
                             @JsonProperty("std") double std,
                             @JsonProperty("default") Double defaultValue) {

    public double standardize(double value) {
        double scale = std == 0.0 ? 1.0 : std;
        return (value - mean) / scale;
    }
}
