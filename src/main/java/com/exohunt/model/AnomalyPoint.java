package com.exohunt.model;

/**
 * A single observation flagged by sigma-clipping.
 *
 * @param time            Observation time in days
 * @param flux            Observed (normalized) flux
 * @param deviationSigma  Absolute deviation from the robust center in units of the robust sigma
 */
public record AnomalyPoint(double time, double flux, double deviationSigma) {
}
