package com.exohunt.visualization;

import com.exohunt.model.AnomalyPoint;
import com.exohunt.model.LightCurveSeries;
import com.exohunt.model.PeriodogramResult;
import com.exohunt.model.PhaseFoldResult;
import com.exohunt.model.TransitCandidate;
import com.exohunt.model.TransitSearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Shapes analysis output into plot-ready structures. Nothing here renders.
 *
 * <p>Long series are decimated by a fixed stride to at most {@code max-points}; anomaly overlays
 * and transit windows are never decimated.
 */
@Component
public class VisualizationDataBuilder {

    private static final Logger log = LoggerFactory.getLogger(VisualizationDataBuilder.class);

    private final int maxPoints;
    private final int foldBins;

    public VisualizationDataBuilder(@Value("${exohunt.visualization.max-points:5000}") int maxPoints,
                                    @Value("${exohunt.visualization.fold-bins:100}") int foldBins) {
        this.maxPoints = maxPoints;
        this.foldBins = foldBins;
    }

    public LightCurvePlot lightCurve(String sourceId, LightCurveSeries series,
                                     List<AnomalyPoint> anomalies, List<TransitCandidate> candidates) {
        double[] time = series.time();
        int stride = stride(time.length);
        List<Double> t = decimate(time, stride);
        List<Double> f = decimate(series.flux(), stride);
        if (stride > 1) log.debug("Decimated {} points with stride {} for {}", time.length, stride, sourceId);

        LightCurvePlot.Overlay overlay = LightCurvePlot.Overlay.EMPTY;
        if (!anomalies.isEmpty()) {
            List<Double> at = new ArrayList<>(anomalies.size());
            List<Double> af = new ArrayList<>(anomalies.size());
            for (AnomalyPoint a : anomalies) {
                at.add(round(a.time()));
                af.add(round(a.flux()));
            }
            overlay = new LightCurvePlot.Overlay(at, af);
        }

        List<TransitWindow> windows = new ArrayList<>();
        if (!series.isEmpty()) {
            for (int c = 0; c < candidates.size(); c++) {
                windows.addAll(transitWindows(candidates.get(c), c, time[0], time[time.length - 1]));
            }
        }
        return new LightCurvePlot(sourceId, t, f, overlay, windows, time.length);
    }

    public FoldedPlot folded(PhaseFoldResult fold) {
        int stride = stride(fold.size());
        double[] sum = new double[foldBins];
        int[] count = new int[foldBins];
        for (int i = 0; i < fold.size(); i++) {
            int b = Math.min((int) (fold.phase()[i] * foldBins), foldBins - 1);
            sum[b] += fold.flux()[i];
            count[b]++;
        }
        List<Double> binnedPhase = new ArrayList<>();
        List<Double> binnedFlux = new ArrayList<>();
        for (int b = 0; b < foldBins; b++) {
            if (count[b] == 0) continue;
            binnedPhase.add(round((b + 0.5) / foldBins));
            binnedFlux.add(round(sum[b] / count[b]));
        }
        return new FoldedPlot(decimate(fold.phase(), stride), decimate(fold.flux(), stride),
                binnedPhase, binnedFlux, fold.period(), fold.epoch());
    }

    public PowerSpectrumPlot powerSpectrum(TransitSearchResult result) {
        Double best = result.best().map(TransitCandidate::period).orElse(null);
        int stride = stride(result.periods().length);
        return new PowerSpectrumPlot(PowerSpectrumPlot.BLS,
                decimate(result.periods(), stride), decimate(result.power(), stride), best);
    }

    public PowerSpectrumPlot powerSpectrum(PeriodogramResult result) {
        int stride = stride(result.periods().length);
        return new PowerSpectrumPlot(PowerSpectrumPlot.LOMB_SCARGLE,
                decimate(result.periods(), stride), decimate(result.power(), stride), result.bestPeriod());
    }

    static List<TransitWindow> transitWindows(TransitCandidate candidate, int index, double from, double to) {
        List<TransitWindow> windows = new ArrayList<>();
        double half = candidate.durationDays() / 2.0;
        double period = candidate.period();
        long first = (long) Math.ceil((from - half - candidate.epoch()) / period);
        for (long k = first; ; k++) {
            double center = candidate.epoch() + k * period;
            if (center - half > to) break;
            windows.add(new TransitWindow(center - half, center + half, index));
        }
        return windows;
    }

    private int stride(int n) {
        return n <= maxPoints ? 1 : (int) Math.ceil((double) n / maxPoints);
    }

    private static List<Double> decimate(double[] values, int stride) {
        List<Double> out = new ArrayList<>(values.length / stride + 1);
        for (int i = 0; i < values.length; i += stride) out.add(round(values[i]));
        return out;
    }

    private static double round(double value) {
        return Math.round(value * 1e6) / 1e6;
    }
}
