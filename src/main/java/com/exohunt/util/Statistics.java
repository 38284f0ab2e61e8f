package com.exohunt.util;

import java.util.Arrays;

/**
 * Small descriptive-statistics helpers shared by the analysis stages.
 * All methods expect finite input; none of them mutate their arguments.
 */
public final class Statistics {

    /** Scale factor turning a median absolute deviation into a Gaussian-equivalent sigma. */
    public static final double MAD_TO_SIGMA = 1.4826;

    private Statistics() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) return Double.NaN;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /**
     * Sample standard deviation (n - 1 denominator); 0 for fewer than two values.
     */
    public static double standardDeviation(double[] values) {
        if (values.length < 2) return 0.0;
        double m = mean(values);
        double ss = 0.0;
        for (double v : values) {
            double d = v - m;
            ss += d * d;
        }
        return Math.sqrt(ss / (values.length - 1));
    }

    public static double median(double[] values) {
        if (values.length == 0) return Double.NaN;
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /**
     * Median of {@code values[from, to)}.
     */
    public static double median(double[] values, int from, int to) {
        return median(Arrays.copyOfRange(values, from, to));
    }

    public static double medianAbsoluteDeviation(double[] values, double center) {
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) deviations[i] = Math.abs(values[i] - center);
        return median(deviations);
    }

    /**
     * Median spacing between consecutive times; NaN for fewer than two points.
     */
    public static double medianCadence(double[] time) {
        if (time.length < 2) return Double.NaN;
        double[] dt = new double[time.length - 1];
        for (int i = 1; i < time.length; i++) dt[i - 1] = time[i] - time[i - 1];
        return median(dt);
    }
}
