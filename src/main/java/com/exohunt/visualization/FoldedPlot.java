package com.exohunt.visualization;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Phase-folded scatter plus the binned mean curve.
 */
public record FoldedPlot(@JsonProperty("phase") List<Double> phase,
                         @JsonProperty("flux") List<Double> flux,
                         @JsonProperty("binned_phase") List<Double> binnedPhase,
                         @JsonProperty("binned_flux") List<Double> binnedFlux,
                         @JsonProperty("period") double period,
                         @JsonProperty("epoch") double epoch) {
}
