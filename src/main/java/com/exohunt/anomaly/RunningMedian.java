package com.exohunt.anomaly;

import com.exohunt.util.Statistics;

/**
 * Centered running median with a window truncated at the series edges.
 */
final class RunningMedian {

    private RunningMedian() {
    }

    /**
     * @param window number of points per window; even values are widened by one
     */
    static double[] smooth(double[] values, int window) {
        int half = (window | 1) / 2;
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int from = Math.max(0, i - half);
            int to = Math.min(values.length, i + half + 1);
            out[i] = Statistics.median(values, from, to);
        }
        return out;
    }
}
