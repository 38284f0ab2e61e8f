package com.exohunt.service;

import com.exohunt.anomaly.SigmaClippingDetector;
import com.exohunt.cache.CacheKey;
import com.exohunt.cache.CacheStage;
import com.exohunt.cache.FeatureCache;
import com.exohunt.error.AnalysisException;
import com.exohunt.error.DataFormatException;
import com.exohunt.error.ErrorKind;
import com.exohunt.extractor.ArchiveDownloader;
import com.exohunt.extractor.TimeSeriesExtractor;
import com.exohunt.fold.PhaseFolder;
import com.exohunt.inference.InferenceAdapter;
import com.exohunt.inference.InferenceContext;
import com.exohunt.model.AnalysisError;
import com.exohunt.model.AnalysisRequest;
import com.exohunt.model.AnomalyPoint;
import com.exohunt.model.ArchiveLightCurve;
import com.exohunt.model.BatchItemResult;
import com.exohunt.model.FeatureVector;
import com.exohunt.model.FluxType;
import com.exohunt.model.LightCurveSeries;
import com.exohunt.model.LightCurveSource;
import com.exohunt.model.PeriodogramResult;
import com.exohunt.model.PhaseFoldResult;
import com.exohunt.model.PredictionResult;
import com.exohunt.model.SignalAnalysisReport;
import com.exohunt.model.SubResult;
import com.exohunt.model.TransitCandidate;
import com.exohunt.model.TransitSearchResult;
import com.exohunt.model.UploadedLightCurve;
import com.exohunt.periodogram.LombScarglePeriodogram;
import com.exohunt.preprocess.PreprocessingPipeline;
import com.exohunt.transit.BoxLeastSquaresSearch;
import com.exohunt.visualization.ComparisonEntry;
import com.exohunt.visualization.FoldedPlot;
import com.exohunt.visualization.LightCurvePlot;
import com.exohunt.visualization.PowerSpectrumPlot;
import com.exohunt.visualization.VisualizationDataBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Entry point of the light-curve core. Wires extraction, caching, the analysis engines, the
 * classifier and the plot builder into the operations callers use:
 * <ul>
 *   <li>{@link #analyze} - classify one source</li>
 *   <li>{@link #searchTransits}, {@link #periodogram}, {@link #phaseFold}, {@link #detectAnomalies}</li>
 *   <li>{@link #analyzeSignals} - the three signal analyses with per-analysis failures</li>
 *   <li>{@link #analyzeBatch} - many classifications in parallel</li>
 *   <li>{@link #visualize}, {@link #compare} - plot data</li>
 * </ul>
 *
 * <p>Downloads, extracted series and feature vectors are cached per source identity; concurrent
 * requests for the same source share one computation.
 */
@Service
public class LightCurveAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(LightCurveAnalysisService.class);

    private final ArchiveDownloader downloader;
    private final TimeSeriesExtractor extractor;
    private final PreprocessingPipeline preprocessing;
    private final FeatureCache cache;
    private final BoxLeastSquaresSearch transitSearch;
    private final LombScarglePeriodogram periodogram;
    private final PhaseFolder phaseFolder;
    private final SigmaClippingDetector anomalyDetector;
    private final InferenceAdapter inferenceAdapter;
    private final InferenceContext defaultContext;
    private final VisualizationDataBuilder plots;
    private final Executor batchExecutor;
    private final AnalysisDefaults defaults;

    public LightCurveAnalysisService(ArchiveDownloader downloader,
                                     TimeSeriesExtractor extractor,
                                     PreprocessingPipeline preprocessing,
                                     FeatureCache cache,
                                     BoxLeastSquaresSearch transitSearch,
                                     LombScarglePeriodogram periodogram,
                                     PhaseFolder phaseFolder,
                                     SigmaClippingDetector anomalyDetector,
                                     InferenceAdapter inferenceAdapter,
                                     InferenceContext defaultContext,
                                     VisualizationDataBuilder plots,
                                     @Qualifier("analysisExecutor") Executor batchExecutor,
                                     AnalysisDefaults defaults) {
        this.downloader = downloader;
        this.extractor = extractor;
        this.preprocessing = preprocessing;
        this.cache = cache;
        this.transitSearch = transitSearch;
        this.periodogram = periodogram;
        this.phaseFolder = phaseFolder;
        this.anomalyDetector = anomalyDetector;
        this.inferenceAdapter = inferenceAdapter;
        this.defaultContext = defaultContext;
        this.plots = plots;
        this.batchExecutor = batchExecutor;
        this.defaults = defaults;
    }

    // ---- classification ----

    public PredictionResult analyze(LightCurveSource source, Map<String, Double> koiParams) {
        return analyze(source, koiParams, defaultContext);
    }

    public PredictionResult analyze(LightCurveSource source, Map<String, Double> koiParams, InferenceContext context) {
        Map<String, Double> params = koiParams == null ? Map.of() : koiParams;
        FeatureVector features = loadFeatures(source);
        PredictionResult result = inferenceAdapter.predict(features, params, context);
        log.info("Classified {} as {} (confidence={}, model={})",
                source.identity(), result.predictedLabel(), result.confidence(), result.modelVersion());
        return result;
    }

    /**
     * Classifies every request on the batch executor. Failures are reported per item; the
     * returned list has the same order as {@code requests}.
     */
    public List<BatchItemResult> analyzeBatch(List<AnalysisRequest> requests) {
        log.info("Starting batch analysis of {} sources", requests.size());
        List<CompletableFuture<BatchItemResult>> futures = requests.stream()
                .map(r -> CompletableFuture.supplyAsync(() -> analyzeItem(r), batchExecutor))
                .toList();
        try {
            List<BatchItemResult> results = futures.stream().map(CompletableFuture::join).toList();
            long failed = results.stream().filter(r -> !r.isSuccess()).count();
            log.info("Batch analysis finished: {} succeeded, {} failed", results.size() - failed, failed);
            return results;
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }
    }

    private BatchItemResult analyzeItem(AnalysisRequest request) {
        String id = request.source().identity();
        try {
            return BatchItemResult.success(id, analyze(request.source(), request.koiParams()));
        } catch (AnalysisException e) {
            log.warn("Batch item {} failed: {} {}", id, e.getKind().getLabel(), e.getMessage());
            return BatchItemResult.failure(id, e.toError());
        } catch (RuntimeException e) {
            log.error("Batch item {} failed unexpectedly", id, e);
            return BatchItemResult.failure(id, internalError(e));
        }
    }

    // ---- signal analyses ----

    public TransitSearchResult searchTransits(LightCurveSource source, double periodMin, double periodMax, double snrThreshold) {
        return transitSearch.search(loadSeries(source), periodMin, periodMax, snrThreshold);
    }

    public TransitSearchResult searchTransits(LightCurveSeries series, double periodMin, double periodMax, double snrThreshold) {
        return transitSearch.search(series, periodMin, periodMax, snrThreshold);
    }

    public List<TransitCandidate> detectTransits(LightCurveSource source, double periodMin, double periodMax, double snrThreshold) {
        return searchTransits(source, periodMin, periodMax, snrThreshold).detected();
    }

    public List<TransitCandidate> detectTransits(LightCurveSeries series, double periodMin, double periodMax, double snrThreshold) {
        return searchTransits(series, periodMin, periodMax, snrThreshold).detected();
    }

    public PeriodogramResult periodogram(LightCurveSource source) {
        return periodogram.compute(loadSeries(source));
    }

    public PeriodogramResult periodogram(LightCurveSeries series) {
        return periodogram.compute(series);
    }

    /**
     * @param epoch reference time of phase zero; null selects the time of minimum flux
     */
    public PhaseFoldResult phaseFold(LightCurveSource source, double period, Double epoch) {
        return phaseFolder.fold(loadSeries(source), period, epoch);
    }

    public PhaseFoldResult phaseFold(LightCurveSeries series, double period, Double epoch) {
        return phaseFolder.fold(series, period, epoch);
    }

    /**
     * @param k clip factor; null selects the configured default
     */
    public List<AnomalyPoint> detectAnomalies(LightCurveSource source, Double k) {
        return detectAnomalies(loadSeries(source), k);
    }

    public List<AnomalyPoint> detectAnomalies(LightCurveSeries series, Double k) {
        return anomalyDetector.detect(series, k == null ? anomalyDetector.getDefaultSigma() : k);
    }

    /**
     * Runs transit search, periodogram and anomaly detection on one source. A failure of one
     * analysis is recorded in its slot; the others still run. Failing to load the source fails
     * the whole call.
     */
    public SignalAnalysisReport analyzeSignals(LightCurveSource source, double periodMin, double periodMax,
                                               double snrThreshold, Double k) {
        LightCurveSeries series = loadSeries(source);
        SignalAnalysisReport report = new SignalAnalysisReport(source.identity(),
                attempt("transit search", () -> transitSearch.search(series, periodMin, periodMax, snrThreshold)),
                attempt("periodogram", () -> periodogram.compute(series)),
                attempt("anomaly detection", () -> detectAnomalies(series, k)));
        log.info("Signal analysis of {} complete={}", source.identity(), report.isComplete());
        return report;
    }

    private static <T> SubResult<T> attempt(String analysis, Supplier<T> work) {
        try {
            return SubResult.ok(work.get());
        } catch (AnalysisException e) {
            log.warn("{} failed: {} {}", analysis, e.getKind().getLabel(), e.getMessage());
            return SubResult.failed(e.toError());
        } catch (RuntimeException e) {
            log.error("{} failed unexpectedly", analysis, e);
            return SubResult.failed(internalError(e));
        }
    }

    /** User-facing error for an untyped failure; the stack trace stays in the log. */
    private static AnalysisError internalError(RuntimeException e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return new AnalysisError(ErrorKind.INTERNAL.getLabel(), message);
    }

    // ---- plots ----

    /**
     * Light-curve plot with anomaly overlay and, when the default search finds any, transit windows.
     */
    public LightCurvePlot visualize(LightCurveSource source) {
        LightCurveSeries series = loadSeries(source);
        return lightCurvePlot(source.identity(), series);
    }

    public FoldedPlot visualizeFold(LightCurveSource source, double period, Double epoch) {
        return plots.folded(phaseFold(source, period, epoch));
    }

    public PowerSpectrumPlot visualizePeriodogram(LightCurveSource source) {
        return plots.powerSpectrum(periodogram(source));
    }

    public PowerSpectrumPlot visualizeTransitSearch(LightCurveSource source, double periodMin, double periodMax, double snrThreshold) {
        return plots.powerSpectrum(searchTransits(source, periodMin, periodMax, snrThreshold));
    }

    /**
     * One plot per source. {@code labels} may be null or shorter than {@code sources}; missing
     * labels default to the source identity.
     */
    public List<ComparisonEntry> compare(List<? extends LightCurveSource> sources, List<String> labels) {
        List<ComparisonEntry> entries = new ArrayList<>(sources.size());
        for (int i = 0; i < sources.size(); i++) {
            LightCurveSource source = sources.get(i);
            String label = labels != null && i < labels.size() && labels.get(i) != null
                    ? labels.get(i) : source.identity();
            try {
                entries.add(new ComparisonEntry(label, lightCurvePlot(label, loadSeries(source)), null));
            } catch (AnalysisException e) {
                log.warn("Comparison entry {} failed: {} {}", label, e.getKind().getLabel(), e.getMessage());
                entries.add(new ComparisonEntry(label, null, e.toError()));
            } catch (RuntimeException e) {
                log.error("Comparison entry {} failed unexpectedly", label, e);
                entries.add(new ComparisonEntry(label, null, internalError(e)));
            }
        }
        return entries;
    }

    private LightCurvePlot lightCurvePlot(String sourceId, LightCurveSeries series) {
        List<AnomalyPoint> anomalies = detectAnomalies(series, null);
        List<TransitCandidate> transits = List.of();
        try {
            transits = transitSearch.detect(series, defaults.periodMin(), defaults.periodMax(), defaults.snrThreshold());
        } catch (AnalysisException e) {
            log.debug("No transit overlay for {}: {}", sourceId, e.getMessage());
        }
        return plots.lightCurve(sourceId, series, anomalies, transits);
    }

    // ---- cached loading ----

    public LightCurveSeries loadSeries(LightCurveSource source) {
        CacheKey key = key(source, CacheStage.SERIES);
        return cache.getOrCompute(key, LightCurveSeries.class,
                () -> extractor.extract(rawBytes(source), defaults.fluxType()));
    }

    public FeatureVector loadFeatures(LightCurveSource source) {
        CacheKey key = key(source, CacheStage.FEATURES);
        return cache.getOrCompute(key, FeatureVector.class, () -> preprocessing.process(loadSeries(source)));
    }

    private byte[] rawBytes(LightCurveSource source) {
        if (source instanceof UploadedLightCurve upload) return upload.content();
        if (source instanceof ArchiveLightCurve archive) {
            return cache.getOrCompute(key(source, CacheStage.RAW), byte[].class,
                    () -> downloader.download(archive.kepid()));
        }
        throw new DataFormatException("Unsupported light-curve source: " + source.getClass().getSimpleName());
    }

    private CacheKey key(LightCurveSource source, CacheStage stage) {
        FluxType flux = stage == CacheStage.RAW ? null : defaults.fluxType();
        return CacheKey.of(source.identity(), flux, defaults.pipelineVersion(), stage);
    }
}
