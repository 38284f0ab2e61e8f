package com.exohunt.anomaly;

import com.exohunt.error.InvalidParameterException;
import com.exohunt.model.AnomalyPoint;
import com.exohunt.model.LightCurveSeries;
import com.exohunt.util.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Flags outliers with iterative, robust sigma-clipping.
 *
 * <p>Center is the median and spread is {@code 1.4826 · MAD} of the currently unflagged values
 * (the standard deviation when the MAD is zero). Flags are recomputed over all values each round
 * until they stop changing or {@code max-iterations} rounds have run.
 */
@Component
public class SigmaClippingDetector {

    private static final Logger log = LoggerFactory.getLogger(SigmaClippingDetector.class);

    private final double defaultSigma;
    private final int maxIterations;
    private final int detrendWindow;

    public SigmaClippingDetector(@Value("${exohunt.anomaly.sigma:5.0}") double defaultSigma,
                                 @Value("${exohunt.anomaly.max-iterations:5}") int maxIterations,
                                 @Value("${exohunt.anomaly.detrend-window:51}") int detrendWindow) {
        this.defaultSigma = defaultSigma;
        this.maxIterations = maxIterations;
        this.detrendWindow = detrendWindow;
    }

    public double getDefaultSigma() {
        return defaultSigma;
    }

    public List<AnomalyPoint> detect(LightCurveSeries series) {
        return detect(series, defaultSigma);
    }

    /**
     * Flags points of a light curve. Slow trends are removed with a running median first;
     * reported flux values are the original ones.
     */
    public List<AnomalyPoint> detect(LightCurveSeries series, double k) {
        double[] flux = series.flux();
        double[] residual = flux;
        if (detrendWindow > 0 && flux.length > detrendWindow) {
            double[] trend = RunningMedian.smooth(flux, detrendWindow);
            residual = new double[flux.length];
            for (int i = 0; i < flux.length; i++) residual[i] = flux[i] - trend[i];
        }

        ClipResult clip = clip(residual, k);
        double[] time = series.time();
        List<AnomalyPoint> anomalies = new ArrayList<>();
        for (int i = 0; i < flux.length; i++) {
            if (clip.flagged()[i]) anomalies.add(new AnomalyPoint(time[i], flux[i], clip.deviation(residual[i])));
        }
        log.debug("Sigma-clipping k={} flagged {} of {} points after {} iterations",
                k, anomalies.size(), flux.length, clip.iterations());
        return anomalies;
    }

    public ClipResult clip(double[] values, double k) {
        if (!Double.isFinite(k) || k <= 0) {
            throw new InvalidParameterException("Clip factor k must be positive, got " + k);
        }
        boolean[] flagged = new boolean[values.length];
        if (values.length == 0) return new ClipResult(flagged, Double.NaN, 0.0, 0);

        double center = Double.NaN;
        double sigma = 0.0;
        int iteration = 0;
        while (iteration < maxIterations) {
            double[] kept = unflagged(values, flagged);
            if (kept.length == 0) break;
            double c = Statistics.median(kept);
            double s = Statistics.MAD_TO_SIGMA * Statistics.medianAbsoluteDeviation(kept, c);
            if (s == 0.0) s = Statistics.standardDeviation(kept);
            if (s == 0.0) {
                // remaining values are identical; nothing further to separate
                if (iteration == 0) center = c;
                break;
            }
            iteration++;
            center = c;
            sigma = s;

            boolean[] next = new boolean[values.length];
            for (int i = 0; i < values.length; i++) next[i] = Math.abs(values[i] - c) > k * s;
            if (Arrays.equals(next, flagged)) break;
            flagged = next;
        }
        return new ClipResult(flagged, center, sigma, iteration);
    }

    private static double[] unflagged(double[] values, boolean[] flagged) {
        int count = 0;
        for (boolean f : flagged) if (!f) count++;
        double[] out = new double[count];
        int j = 0;
        for (int i = 0; i < values.length; i++) if (!flagged[i]) out[j++] = values[i];
        return out;
    }
}
