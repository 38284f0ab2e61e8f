package com.exohunt.periodogram;

import com.exohunt.error.InsufficientDataException;
import com.exohunt.model.LightCurveSeries;
import com.exohunt.model.PeriodogramResult;
import com.exohunt.util.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Classical Lomb-Scargle periodogram for unevenly sampled data, standard normalization.
 *
 * <p>The frequency grid is uniform from {@code 1/T} to the pseudo-Nyquist {@code 1/(2·median Δt)}
 * with step {@code 1/(oversample·T)}. The per-point {@code cos}/{@code sin} of {@code ωt} are
 * advanced with a trigonometric recurrence instead of being recomputed at every frequency.
 */
@Component
public class LombScarglePeriodogram {

    private static final Logger log = LoggerFactory.getLogger(LombScarglePeriodogram.class);

    private static final double TWO_PI = 2.0 * Math.PI;

    private final double oversample;
    private final int maxFrequencies;

    public LombScarglePeriodogram(@Value("${exohunt.periodogram.oversample:5}") double oversample,
                                  @Value("${exohunt.periodogram.max-frequencies:20000}") int maxFrequencies) {
        this.oversample = oversample;
        this.maxFrequencies = maxFrequencies;
    }

    public PeriodogramResult compute(LightCurveSeries series) {
        return compute(series.time(), series.flux());
    }

    public PeriodogramResult compute(double[] time, double[] flux) {
        int n = time.length;
        if (n < 3) throw new InsufficientDataException("Periodogram needs at least 3 points, got " + n);

        double mean = Statistics.mean(flux);
        double[] y = new double[n];
        double yy = 0.0;
        for (int i = 0; i < n; i++) {
            y[i] = flux[i] - mean;
            yy += y[i] * y[i];
        }
        if (!(yy > 0)) throw new InsufficientDataException("Flux has zero variance; periodogram undefined");

        double baseline = time[n - 1] - time[0];
        double cadence = Statistics.medianCadence(time);
        if (!(baseline > 0) || !(cadence > 0)) {
            throw new InsufficientDataException("Time samples span no interval; periodogram undefined");
        }
        double fMin = 1.0 / baseline;
        double fMax = 1.0 / (2.0 * cadence);
        double df = 1.0 / (oversample * baseline);
        int count = (int) Math.floor((fMax - fMin) / df) + 1;
        if (count > maxFrequencies) {
            count = maxFrequencies;
            df = (fMax - fMin) / (count - 1);
        }
        if (count < 1) throw new InsufficientDataException("Sampling too sparse for any frequency above 1/baseline");

        double[] power = powerSpectrum(time, y, yy, fMin, df, count);

        // frequencies ascend, so periods come out descending; reverse them
        double[] periods = new double[count];
        double[] ascendingPower = new double[count];
        int best = 0;
        for (int k = 0; k < count; k++) {
            int j = count - 1 - k;
            periods[j] = 1.0 / (fMin + k * df);
            ascendingPower[j] = power[k];
            if (power[k] > power[best]) best = k;
        }
        double bestPeriod = 1.0 / (fMin + best * df);
        log.debug("Lomb-Scargle: {} frequencies, best period={} power={}", count, bestPeriod, power[best]);
        return new PeriodogramResult(periods, ascendingPower, bestPeriod, power[best]);
    }

    private static double[] powerSpectrum(double[] time, double[] y, double yy, double fMin, double df, int count) {
        int n = time.length;
        // wr/wi hold cos/sin(ω t_i) at the current frequency; wpr/wpi the rotation by df
        double[] wr = new double[n];
        double[] wi = new double[n];
        double[] wpr = new double[n];
        double[] wpi = new double[n];
        double t0 = time[0];
        for (int i = 0; i < n; i++) {
            double t = time[i] - t0;
            wr[i] = Math.cos(TWO_PI * fMin * t);
            wi[i] = Math.sin(TWO_PI * fMin * t);
            wpr[i] = Math.cos(TWO_PI * df * t);
            wpi[i] = Math.sin(TWO_PI * df * t);
        }

        double[] power = new double[count];
        for (int k = 0; k < count; k++) {
            double sin2 = 0.0;
            double cos2 = 0.0;
            for (int i = 0; i < n; i++) {
                sin2 += 2.0 * wi[i] * wr[i];
                cos2 += wr[i] * wr[i] - wi[i] * wi[i];
            }
            double halfAngle = 0.5 * Math.atan2(sin2, cos2);
            double c = Math.cos(halfAngle);
            double s = Math.sin(halfAngle);

            double yc = 0.0;
            double ys = 0.0;
            double cc = 0.0;
            double ss = 0.0;
            for (int i = 0; i < n; i++) {
                double cosArg = wr[i] * c + wi[i] * s;
                double sinArg = wi[i] * c - wr[i] * s;
                yc += y[i] * cosArg;
                ys += y[i] * sinArg;
                cc += cosArg * cosArg;
                ss += sinArg * sinArg;

                double r = wr[i];
                wr[i] = r * wpr[i] - wi[i] * wpi[i];
                wi[i] = wi[i] * wpr[i] + r * wpi[i];
            }
            double p = (cc > 0 ? yc * yc / cc : 0.0) + (ss > 0 ? ys * ys / ss : 0.0);
            power[k] = Math.min(1.0, Math.max(0.0, p / yy));
        }
        return power;
    }
}
