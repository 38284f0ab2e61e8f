package com.exohunt.visualization;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Power over period from either search method.
 */
public record PowerSpectrumPlot(@JsonProperty("method") String method,
                                @JsonProperty("period") List<Double> periods,
                                @JsonProperty("power") List<Double> power,
                                @JsonProperty("best_period") Double bestPeriod) {

    public static final String BLS = "BLS";
    public static final String LOMB_SCARGLE = "LombScargle";
}
