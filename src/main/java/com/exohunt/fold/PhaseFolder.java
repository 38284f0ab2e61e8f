package com.exohunt.fold;

import com.exohunt.error.InsufficientDataException;
import com.exohunt.error.InvalidParameterException;
import com.exohunt.model.LightCurveSeries;
import com.exohunt.model.PhaseFoldResult;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Folds a light curve on a trial period.
 *
 * <p>{@code phase = ((t - epoch) mod P) / P}, always in [0, 1). Points are ordered by phase; equal
 * phases keep their original time order.
 */
@Component
public class PhaseFolder {

    /** Phases this close to a whole cycle are rounding noise and fold to zero. */
    static final double WRAP_TOLERANCE = 1e-9;

    /**
     * Folds with the epoch set to the time of minimum flux.
     */
    public PhaseFoldResult fold(LightCurveSeries series, double period) {
        if (series.isEmpty()) throw new InsufficientDataException("Cannot fold an empty light curve");
        return fold(series, period, timeOfMinimum(series));
    }

    public PhaseFoldResult fold(LightCurveSeries series, double period, Double epoch) {
        if (epoch == null) return fold(series, period);
        if (!Double.isFinite(period) || period <= 0) {
            throw new InvalidParameterException("Period must be positive and finite, got " + period);
        }
        if (!Double.isFinite(epoch)) throw new InvalidParameterException("Epoch must be finite, got " + epoch);
        if (series.isEmpty()) throw new InsufficientDataException("Cannot fold an empty light curve");

        double[] time = series.time();
        double[] flux = series.flux();
        int n = time.length;
        // epochs a whole number of periods apart share one reference at or before the first point
        double reference = epoch - period * Math.floor((epoch - time[0]) / period);
        double[] phase = new double[n];
        for (int i = 0; i < n; i++) phase[i] = phaseOf(time[i], period, reference);

        // stable sort keeps ascending-time order among equal phases
        int[] order = IntStream.range(0, n).boxed()
                .sorted(Comparator.comparingDouble(i -> phase[i]))
                .mapToInt(Integer::intValue)
                .toArray();

        double[] sortedPhase = new double[n];
        double[] sortedFlux = new double[n];
        double[] sortedTime = new double[n];
        for (int k = 0; k < n; k++) {
            sortedPhase[k] = phase[order[k]];
            sortedFlux[k] = flux[order[k]];
            sortedTime[k] = time[order[k]];
        }
        return new PhaseFoldResult(sortedPhase, sortedFlux, sortedTime, period, epoch);
    }

    static double phaseOf(double t, double period, double epoch) {
        double x = t - epoch;
        double wrapped = x - period * Math.floor(x / period);
        double phase = wrapped / period;
        return phase < WRAP_TOLERANCE || phase > 1.0 - WRAP_TOLERANCE ? 0.0 : phase;
    }

    private static double timeOfMinimum(LightCurveSeries series) {
        double[] flux = series.flux();
        int min = 0;
        for (int i = 1; i < flux.length; i++) if (flux[i] < flux[min]) min = i;
        return series.time()[min];
    }
}
