package com.exohunt.anomaly;

/**
 * Outcome of iterative sigma-clipping over one array.
 *
 * @param flagged     {@code true} for every value outside {@code center ± k·sigma}
 * @param center      Final robust center (median of the unflagged values)
 * @param sigma       Final robust spread
 * @param iterations  Number of re-estimation rounds that ran
 */
public record ClipResult(boolean[] flagged, double center, double sigma, int iterations) {

    public int flaggedCount() {
        int n = 0;
        for (boolean f : flagged) if (f) n++;
        return n;
    }

    /** Distance of {@code value} from the center in units of sigma. */
    public double deviation(double value) {
        return sigma > 0 ? Math.abs(value - center) / sigma : 0.0;
    }
}
