package com.exohunt.model;

/**
 * Light curve remapped onto orbital phase, ordered by ascending phase.
 *
 * @param phase   Phases in [0, 1)
 * @param flux    Flux reordered to match {@code phase}
 * @param time    Original observation times reordered to match {@code phase}
 * @param period  Folding period in days
 * @param epoch   Reference time of phase zero in days
 */
public record PhaseFoldResult(double[] phase, double[] flux, double[] time, double period, double epoch) {

    public int size() {
        return phase.length;
    }
}
