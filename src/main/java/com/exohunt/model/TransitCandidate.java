package com.exohunt.model;

import com.exohunt.error.InvalidParameterException;

/**
 * A periodic box-shaped dip found by the transit search.
 *
 * @param period           Orbital period in days
 * @param epoch            Mid-transit time of the first transit at or after the series start (days)
 * @param depthPpm         Transit depth in parts per million of the out-of-transit level
 * @param durationHours    Box duration in hours
 * @param snr              Depth over the standard error of the in-transit mean
 * @param inTransitPoints  Number of observations inside the box
 * @param method           Search method that produced the candidate
 */
public record TransitCandidate(double period,
                               double epoch,
                               double depthPpm,
                               double durationHours,
                               double snr,
                               int inTransitPoints,
                               String method) {

    public static final String BLS = "BLS";

    public TransitCandidate {
        if (!(period > 0)) throw new InvalidParameterException("Period must be positive");
        if (!(durationHours > 0)) throw new InvalidParameterException("Duration must be positive");
        if (inTransitPoints < 0) throw new InvalidParameterException("In-transit point count must be non-negative");
    }

    public boolean meets(double snrThreshold) {
        return snr >= snrThreshold;
    }

    public double durationDays() {
        return durationHours / 24.0;
    }
}
