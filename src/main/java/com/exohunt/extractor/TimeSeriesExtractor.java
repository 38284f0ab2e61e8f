package com.exohunt.extractor;

import com.exohunt.error.DataFormatException;
import com.exohunt.error.InsufficientDataException;
import com.exohunt.model.FluxType;
import com.exohunt.model.LightCurveSeries;
import com.exohunt.util.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Turns raw source bytes into a validated, normalized {@link LightCurveSeries}.
 *
 * <p>Steps, in order:
 * <ul>
 *   <li>pick the first format provider that recognizes the bytes</li>
 *   <li>choose the preferred flux column, falling back to the other product</li>
 *   <li>drop rows with non-finite time/flux or a non-zero quality flag</li>
 *   <li>sort by time and drop duplicate timestamps (first occurrence wins)</li>
 *   <li>divide each segment by its own median flux</li>
 *   <li>count cadence gaps; gaps are recorded, never filled</li>
 * </ul>
 */
@Component
public class TimeSeriesExtractor {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesExtractor.class);

    private final List<LightCurveFormatProvider> providers;
    private final int minPoints;
    private final double gapFactor;
    private final double segmentGapDays;

    public TimeSeriesExtractor(List<LightCurveFormatProvider> providers,
                               @Value("${exohunt.extractor.min-points:50}") int minPoints,
                               @Value("${exohunt.extractor.gap-factor:5.0}") double gapFactor,
                               @Value("${exohunt.extractor.segment-gap-days:1.0}") double segmentGapDays) {
        this.providers = List.copyOf(providers);
        this.minPoints = minPoints;
        this.gapFactor = gapFactor;
        this.segmentGapDays = segmentGapDays;
    }

    public LightCurveSeries extract(byte[] content, FluxType preferred) {
        LightCurveFormatProvider provider = providers.stream()
                .filter(p -> p.supports(content))
                .findFirst()
                .orElseThrow(() -> new DataFormatException("No format provider recognizes the light-curve content"));
        log.debug("Reading {} bytes with provider={}", content.length, provider.name());
        return extract(provider.load(content), preferred);
    }

    public LightCurveSeries extract(RawLightCurve raw, FluxType preferred) {
        FluxType type = selectFluxType(raw, preferred);
        double[] time = raw.time();
        double[] flux = raw.flux(type);
        int[] quality = raw.quality();
        if (flux.length != time.length || (quality != null && quality.length != time.length)) {
            throw new DataFormatException("Column lengths differ in light-curve source");
        }

        Integer[] kept = usableRows(time, flux, quality);
        if (kept.length < minPoints) {
            throw new InsufficientDataException(String.format(
                    "Only %d of %d points are usable; at least %d required", kept.length, time.length, minPoints));
        }
        Arrays.sort(kept, Comparator.comparingDouble(i -> time[i]));

        double[] t = new double[kept.length];
        double[] f = new double[kept.length];
        int n = 0;
        for (int idx : kept) {
            if (n > 0 && time[idx] == t[n - 1]) continue;
            t[n] = time[idx];
            f[n] = flux[idx];
            n++;
        }
        if (n < minPoints) {
            throw new InsufficientDataException(String.format(
                    "Only %d distinct timestamps remain; at least %d required", n, minPoints));
        }
        t = Arrays.copyOf(t, n);
        f = Arrays.copyOf(f, n);

        int segments = normalizeBySegment(t, f);
        int gaps = countGaps(t);
        String mission = raw.meta("MISSION").or(() -> raw.meta("TELESCOP")).orElse(LightCurveSeries.UNKNOWN_MISSION);
        String targetId = raw.meta("KEPLERID").or(() -> raw.meta("OBJECT")).orElse(null);

        log.info("Extracted light curve: target={} fluxType={} points={}/{} segments={} gaps={}",
                targetId, type, n, time.length, segments, gaps);
        return new LightCurveSeries(t, f, new int[n], mission, type, gaps, targetId);
    }

    private static FluxType selectFluxType(RawLightCurve raw, FluxType preferred) {
        if (raw.has(preferred)) return preferred;
        if (raw.has(preferred.fallback())) {
            log.debug("Flux column {} absent, falling back to {}", preferred, preferred.fallback());
            return preferred.fallback();
        }
        throw new DataFormatException("No usable flux column (expected " + FluxType.PDCSAP.getColumnName()
                + " or " + FluxType.SAP.getColumnName() + ")");
    }

    private static Integer[] usableRows(double[] time, double[] flux, int[] quality) {
        return IntStream.range(0, time.length)
                .filter(i -> Double.isFinite(time[i]) && Double.isFinite(flux[i]))
                .filter(i -> quality == null || quality[i] == 0)
                .boxed()
                .toArray(Integer[]::new);
    }

    /** Divides each gap-separated segment by its median in place; returns the segment count. */
    private int normalizeBySegment(double[] t, double[] f) {
        int segments = 0;
        int start = 0;
        for (int i = 1; i <= t.length; i++) {
            if (i < t.length && t[i] - t[i - 1] <= segmentGapDays) continue;
            double median = Statistics.median(f, start, i);
            if (!(median > 0)) {
                throw new DataFormatException(String.format(
                        "Segment starting at t=%.5f has non-positive median flux %.5g", t[start], median));
            }
            for (int j = start; j < i; j++) f[j] /= median;
            segments++;
            start = i;
        }
        return segments;
    }

    private int countGaps(double[] t) {
        double cadence = Statistics.medianCadence(t);
        if (!(cadence > 0)) return 0;
        int gaps = 0;
        for (int i = 1; i < t.length; i++) {
            if (t[i] - t[i - 1] > gapFactor * cadence) gaps++;
        }
        return gaps;
    }
}
