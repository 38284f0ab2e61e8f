package com.exohunt.transit;

import com.exohunt.error.InsufficientDataException;
import com.exohunt.error.InvalidParameterException;
import com.exohunt.model.LightCurveSeries;
import com.exohunt.model.TransitCandidate;
import com.exohunt.model.TransitSearchResult;
import com.exohunt.util.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

/**
 * Box-least-squares search for periodic transit-like dips.
 *
 * <p>For every trial period the series is folded into {@code phaseBins} bins and every contiguous
 * (wrap-around) run of bins up to {@code maxDutyCycle} of the orbit is scored with
 * {@code Δχ² = S² / (n_in (1 - n_in / N))}, where {@code S} is the summed residual inside the
 * box. Only dips count. Dividing by the total sum of squares gives a power in [0, 1].
 *
 * <p>Trial frequencies are spaced {@code minDutyCycle / (oversample · baseline)} apart. When that
 * needs more than {@code maxPeriods} trials the grid is spread evenly over the range instead, and
 * each pass re-searches the neighborhood of its best coarse period at the full spacing.
 *
 * <p>The best period is re-measured on the unbinned points. Its transits are then masked out and
 * the search repeats, so a single call can return several planets. Trial periods are scored
 * concurrently on the shared search pool; each period writes only its own slot, so the outcome
 * does not depend on scheduling.
 */
@Component
public class BoxLeastSquaresSearch {

    private static final Logger log = LoggerFactory.getLogger(BoxLeastSquaresSearch.class);

    /** Minimum observed cycles a trial period must span. */
    static final double MIN_CYCLES = 2.0;

    private final ForkJoinPool pool;
    private final int phaseBins;
    private final double minDutyCycle;
    private final double maxDutyCycle;
    private final double oversample;
    private final int maxPeriods;
    private final int maxCandidates;

    public BoxLeastSquaresSearch(@Qualifier("transitSearchPool") ForkJoinPool pool,
                                 @Value("${exohunt.transit.phase-bins:200}") int phaseBins,
                                 @Value("${exohunt.transit.min-duty-cycle:0.01}") double minDutyCycle,
                                 @Value("${exohunt.transit.max-duty-cycle:0.2}") double maxDutyCycle,
                                 @Value("${exohunt.transit.oversample:2}") double oversample,
                                 @Value("${exohunt.transit.max-periods:20000}") int maxPeriods,
                                 @Value("${exohunt.transit.max-candidates:3}") int maxCandidates) {
        this.pool = pool;
        this.phaseBins = phaseBins;
        this.minDutyCycle = minDutyCycle;
        this.maxDutyCycle = maxDutyCycle;
        this.oversample = oversample;
        this.maxPeriods = maxPeriods;
        this.maxCandidates = maxCandidates;
    }

    public TransitSearchResult search(LightCurveSeries series, double periodMin, double periodMax, double snrThreshold) {
        validate(periodMin, periodMax, snrThreshold);
        if (series.size() < 3) {
            throw new InsufficientDataException("Transit search needs at least 3 points, got " + series.size());
        }
        double baseline = series.durationDays();
        double longest = Math.min(periodMax, baseline / MIN_CYCLES);
        if (longest < periodMin) {
            throw new InsufficientDataException(String.format(
                    "Baseline of %.3f days covers fewer than %.0f cycles of any period in [%.3f, %.3f]",
                    baseline, MIN_CYCLES, periodMin, periodMax));
        }
        double[] periods = periodGrid(periodMin, longest, baseline);
        double step = frequencyStep(baseline);
        boolean capped = requiredPeriods(periodMin, longest, baseline) > periods.length;
        if (capped) {
            log.warn("BLS grid capped at {} periods ({} needed for [{}, {}] over {} days); best periods are re-searched at full resolution",
                    periods.length, requiredPeriods(periodMin, longest, baseline), periodMin, longest, baseline);
        }
        log.debug("BLS grid: {} periods in [{}, {}] over {} points", periods.length, periodMin, longest, series.size());

        double[] time = series.time();
        double[] flux = series.flux();
        double[] firstPower = null;
        List<TransitCandidate> candidates = new ArrayList<>();

        for (int pass = 0; pass < maxCandidates && time.length >= 3; pass++) {
            BoxFit[] fits = scoreAll(time, flux, periods);
            if (firstPower == null) {
                firstPower = new double[periods.length];
                for (int i = 0; i < fits.length; i++) firstPower[i] = fits[i].power();
            }
            int best = argmax(fits);
            if (fits[best].isEmpty()) break;
            double period = periods[best];
            BoxFit fit = fits[best];
            if (capped) {
                double[] local = localGrid(periods, best, step);
                BoxFit[] localFits = scoreAll(time, flux, local);
                int localBest = argmax(localFits);
                if (localFits[localBest].power() > fit.power()) {
                    period = local[localBest];
                    fit = localFits[localBest];
                }
            }

            TransitCandidate candidate = refine(time, flux, period, fit);
            if (candidate == null) break;
            candidates.add(candidate);
            log.debug("BLS pass {}: period={} depthPpm={} snr={}", pass + 1,
                    candidate.period(), candidate.depthPpm(), candidate.snr());
            if (!candidate.meets(snrThreshold)) break;

            boolean[] keep = outsideTransits(time, candidate);
            time = select(time, keep);
            flux = select(flux, keep);
        }

        if (firstPower == null) firstPower = new double[periods.length];
        candidates.sort(Comparator.comparingDouble(TransitCandidate::snr).reversed());
        TransitSearchResult result = new TransitSearchResult(periods, firstPower, candidates, snrThreshold, capped);
        log.info("BLS search finished: periods={} candidates={} detected={}",
                periods.length, candidates.size(), result.detected().size());
        return result;
    }

    /** Candidates meeting the threshold, highest SNR first. */
    public List<TransitCandidate> detect(LightCurveSeries series, double periodMin, double periodMax, double snrThreshold) {
        return search(series, periodMin, periodMax, snrThreshold).detected();
    }

    private static void validate(double periodMin, double periodMax, double snrThreshold) {
        if (!Double.isFinite(periodMin) || !Double.isFinite(periodMax) || !Double.isFinite(snrThreshold)) {
            throw new InvalidParameterException("Period bounds and SNR threshold must be finite");
        }
        if (periodMin <= 0) throw new InvalidParameterException("periodMin must be positive, got " + periodMin);
        if (periodMax <= periodMin) {
            throw new InvalidParameterException("periodMax (" + periodMax + ") must exceed periodMin (" + periodMin + ")");
        }
        if (snrThreshold < 0) throw new InvalidParameterException("snrThreshold must be non-negative, got " + snrThreshold);
    }

    /**
     * Trial periods, ascending, from a uniform frequency grid.
     */
    double[] periodGrid(double periodMin, double periodMax, double baseline) {
        double fMin = 1.0 / periodMax;
        double fMax = 1.0 / periodMin;
        double df = frequencyStep(baseline);
        long required = requiredPeriods(periodMin, periodMax, baseline);
        int count = (int) Math.min(required, maxPeriods);
        if (required > maxPeriods && count > 1) df = (fMax - fMin) / (count - 1);
        double[] periods = new double[Math.max(count, 1)];
        // highest frequency first so that periods come out ascending
        for (int i = 0; i < periods.length; i++) {
            periods[i] = 1.0 / (fMax - i * df);
        }
        if (periods.length == 1) periods[0] = periodMin;
        return periods;
    }

    /** Frequency spacing (1/day) that keeps a transit of the shortest duty cycle in phase over the baseline. */
    double frequencyStep(double baseline) {
        return minDutyCycle / (oversample * baseline);
    }

    long requiredPeriods(double periodMin, double periodMax, double baseline) {
        return (long) Math.floor((1.0 / periodMin - 1.0 / periodMax) / frequencyStep(baseline)) + 1;
    }

    /**
     * Periods at full frequency resolution between the coarse neighbors of {@code best}, ascending.
     */
    double[] localGrid(double[] periods, int best, double step) {
        double fBest = 1.0 / periods[best];
        double fLow = 1.0 / periods[Math.min(best + 1, periods.length - 1)];
        double fHigh = 1.0 / periods[Math.max(best - 1, 0)];
        int count = (int) Math.floor((fHigh - fLow) / step) + 1;
        if (count > maxPeriods) {
            count = maxPeriods;
            fHigh = fBest + (count / 2) * step;
        }
        double[] local = new double[Math.max(count, 1)];
        for (int i = 0; i < local.length; i++) local[i] = 1.0 / (fHigh - i * step);
        return local;
    }

    private BoxFit[] scoreAll(double[] time, double[] flux, double[] periods) {
        double mean = Statistics.mean(flux);
        double[] residual = new double[flux.length];
        double total = 0.0;
        for (int i = 0; i < flux.length; i++) {
            residual[i] = flux[i] - mean;
            total += residual[i] * residual[i];
        }
        BoxFit[] fits = new BoxFit[periods.length];
        if (!(total > 0)) {
            Arrays.fill(fits, BoxFit.NONE);
            return fits;
        }
        double sumSquares = total;
        double t0 = time[0];
        pool.submit(() -> IntStream.range(0, periods.length).parallel()
                .forEach(i -> fits[i] = bestBox(time, residual, t0, periods[i], sumSquares)))
                .join();
        return fits;
    }

    private BoxFit bestBox(double[] time, double[] residual, double t0, double period, double sumSquares) {
        int bins = phaseBins;
        double[] sums = new double[bins];
        int[] counts = new int[bins];
        for (int i = 0; i < time.length; i++) {
            int b = phaseBin(time[i], t0, period, bins);
            sums[b] += residual[i];
            counts[b]++;
        }

        int n = time.length;
        int maxWidth = Math.max(1, (int) (maxDutyCycle * bins));
        double bestStat = 0.0;
        int bestStart = 0;
        int bestWidth = 0;
        for (int start = 0; start < bins; start++) {
            double s = 0.0;
            int inBox = 0;
            for (int w = 1; w <= maxWidth; w++) {
                int b = (start + w - 1) % bins;
                s += sums[b];
                inBox += counts[b];
                if (s >= 0 || inBox == 0 || inBox == n) continue;
                double stat = s * s / (inBox * (1.0 - (double) inBox / n));
                if (stat > bestStat) {
                    bestStat = stat;
                    bestStart = start;
                    bestWidth = w;
                }
            }
        }
        return bestWidth == 0 ? BoxFit.NONE : new BoxFit(bestStat / sumSquares, bestStart, bestWidth);
    }

    /**
     * Measures depth, duration, epoch and SNR of the box on the unbinned points.
     */
    private TransitCandidate refine(double[] time, double[] flux, double period, BoxFit fit) {
        double t0 = time[0];
        double inSum = 0.0;
        int inCount = 0;
        List<Double> outside = new ArrayList<>();
        for (int i = 0; i < time.length; i++) {
            int b = phaseBin(time[i], t0, period, phaseBins);
            int offset = Math.floorMod(b - fit.startBin(), phaseBins);
            if (offset < fit.width()) {
                inSum += flux[i];
                inCount++;
            } else {
                outside.add(flux[i]);
            }
        }
        if (inCount == 0 || outside.size() < 2) return null;

        double[] out = outside.stream().mapToDouble(Double::doubleValue).toArray();
        double meanIn = inSum / inCount;
        double meanOut = Statistics.mean(out);
        double sigmaOut = Statistics.standardDeviation(out);
        double depth = meanOut - meanIn;
        double snr = sigmaOut > 0 ? depth / (sigmaOut / Math.sqrt(inCount)) : 0.0;

        double epoch = t0 + fit.centerPhase(phaseBins) * period;
        double durationHours = (double) fit.width() / phaseBins * period * 24.0;
        double depthPpm = depth / meanOut * 1e6;
        return new TransitCandidate(period, epoch, depthPpm, durationHours, snr, inCount, TransitCandidate.BLS);
    }

    /**
     * Marks points farther than one transit duration from every predicted mid-transit time.
     */
    static boolean[] outsideTransits(double[] time, TransitCandidate c) {
        double halfWindow = c.durationDays();
        boolean[] keep = new boolean[time.length];
        for (int i = 0; i < time.length; i++) {
            double cycles = Math.rint((time[i] - c.epoch()) / c.period());
            double distance = Math.abs(time[i] - (c.epoch() + cycles * c.period()));
            keep[i] = distance > halfWindow;
        }
        return keep;
    }

    private static int phaseBin(double t, double t0, double period, int bins) {
        double x = (t - t0) / period;
        double phase = x - Math.floor(x);
        int b = (int) (phase * bins);
        return b >= bins ? bins - 1 : b;
    }

    private static int argmax(BoxFit[] fits) {
        int best = 0;
        for (int i = 1; i < fits.length; i++) {
            if (fits[i].power() > fits[best].power()) best = i;
        }
        return best;
    }

    private static double[] select(double[] values, boolean[] keep) {
        int count = 0;
        for (boolean k : keep) if (k) count++;
        double[] out = new double[count];
        int j = 0;
        for (int i = 0; i < values.length; i++) if (keep[i]) out[j++] = values[i];
        return out;
    }
}
