package com.exohunt.service;

import com.exohunt.anomaly.SigmaClippingDetector;
import com.exohunt.cache.FeatureCache;
import com.exohunt.cache.InMemoryCacheStore;
import com.exohunt.error.DataFormatException;
import com.exohunt.error.FetchTimeoutException;
import com.exohunt.error.MissingFeatureException;
import com.exohunt.extractor.ArchiveDownloader;
import com.exohunt.extractor.DelimitedTextFormatProvider;
import com.exohunt.extractor.TimeSeriesExtractor;
import com.exohunt.fold.PhaseFolder;
import com.exohunt.inference.InferenceAdapter;
import com.exohunt.inference.InferenceContext;
import com.exohunt.inference.ScalerTableLoader;
import com.exohunt.model.AnalysisRequest;
import com.exohunt.model.AnomalyPoint;
import com.exohunt.model.ArchiveLightCurve;
import com.exohunt.model.BatchItemResult;
import com.exohunt.model.Classification;
import com.exohunt.model.FluxType;
import com.exohunt.model.LightCurveSeries;
import com.exohunt.model.LightCurveSource;
import com.exohunt.model.PeriodogramResult;
import com.exohunt.model.PhaseFoldResult;
import com.exohunt.model.PredictionResult;
import com.exohunt.model.SignalAnalysisReport;
import com.exohunt.model.TransitCandidate;
import com.exohunt.model.UploadedLightCurve;
import com.exohunt.periodogram.LombScarglePeriodogram;
import com.exohunt.preprocess.PreprocessingPipeline;
import com.exohunt.support.FixedClassifier;
import com.exohunt.support.KoiParams;
import com.exohunt.support.MutableClock;
import com.exohunt.support.SyntheticLightCurves;
import com.exohunt.transit.BoxLeastSquaresSearch;
import com.exohunt.visualization.ComparisonEntry;
import com.exohunt.visualization.LightCurvePlot;
import com.exohunt.visualization.VisualizationDataBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Exercises the facade end to end with real analysis components, an in-memory archive and a
 * fixed classifier.
 */
@DisplayName("LightCurveAnalysisService")
class LightCurveAnalysisServiceTest {

    private static final long TRANSITING_KEPID = 757450L;
    private static final long MISSING_KEPID = 1L;
    private static final long SLOW_KEPID = 2L;

    private final Map<Long, AtomicInteger> downloads = new ConcurrentHashMap<>();
    private final Map<Long, byte[]> archive = new ConcurrentHashMap<>();

    private ArchiveDownloader downloader;
    private ForkJoinPool pool;
    private ExecutorService batchExecutor;
    private MutableClock clock;
    private FixedClassifier classifier;
    private InferenceContext context;
    private LightCurveAnalysisService service;

    @BeforeEach
    void setUp() {
        LightCurveSeries transiting = SyntheticLightCurves.transiting(42L, 4000, 90.0, 0.001, 3.52, 1.3, 0.02, 2.5);
        archive.put(TRANSITING_KEPID, SyntheticLightCurves.csv(transiting, 12000.0, TRANSITING_KEPID)
                .getBytes(StandardCharsets.UTF_8));

        downloader = kepid -> {
            downloads.computeIfAbsent(kepid, k -> new AtomicInteger()).incrementAndGet();
            if (kepid == SLOW_KEPID) throw new FetchTimeoutException("kic:" + kepid, Duration.ofSeconds(30), null);
            byte[] bytes = archive.get(kepid);
            if (bytes == null) throw new DataFormatException("Archive has no light curve for kic:" + kepid + " (HTTP 404)");
            sleep(100);
            return bytes;
        };

        pool = new ForkJoinPool(4);
        batchExecutor = Executors.newFixedThreadPool(4);
        clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
        classifier = new FixedClassifier(0.05, 0.15, 0.80);
        context = new InferenceContext("v1.0",
                ScalerTableLoader.load(new ClassPathResource("model/koi-scaler.json"), new ObjectMapper()),
                classifier, PreprocessingPipeline.SEQUENCE_LENGTH);

        service = newService(new LombScarglePeriodogram(5, 20000));
    }

    private LightCurveAnalysisService newService(LombScarglePeriodogram periodogram) {
        return new LightCurveAnalysisService(
                downloader,
                new TimeSeriesExtractor(List.of(new DelimitedTextFormatProvider()), 50, 5.0, 1.0),
                new PreprocessingPipeline(),
                new FeatureCache(new InMemoryCacheStore(), clock, Duration.ofHours(24)),
                new BoxLeastSquaresSearch(pool, 200, 0.01, 0.2, 2, 20000, 3),
                periodogram,
                new PhaseFolder(),
                new SigmaClippingDetector(5.0, 5, 51),
                new InferenceAdapter(),
                context,
                new VisualizationDataBuilder(5000, 100),
                batchExecutor,
                new AnalysisDefaults(FluxType.PDCSAP, "v1", 0.5, 10.0, 7.0));
    }

    @AfterEach
    void tearDown() {
        pool.shutdown();
        batchExecutor.shutdown();
    }

    private int downloadCount(long kepid) {
        AtomicInteger count = downloads.get(kepid);
        return count == null ? 0 : count.get();
    }

    @Nested
    @DisplayName("Classification")
    class Classify {

        @Test
        @DisplayName("analyze returns the decoded prediction and repeats bit-identically")
        void analyzeTwice() {
            ArchiveLightCurve source = new ArchiveLightCurve(TRANSITING_KEPID);

            PredictionResult first = service.analyze(source, KoiParams.complete());
            PredictionResult second = service.analyze(source, KoiParams.complete());

            assertThat(first.predictedLabel()).isEqualTo(Classification.CONFIRMED);
            assertThat(second.probabilities()).isEqualTo(first.probabilities());
            assertThat(downloadCount(TRANSITING_KEPID)).isEqualTo(1);
            assertThat(classifier.lastSequence()).hasSize(PreprocessingPipeline.SEQUENCE_LENGTH);
        }

        @Test
        @DisplayName("concurrent requests for one source download it once")
        void singleDownloadUnderConcurrency() throws Exception {
            ArchiveLightCurve source = new ArchiveLightCurve(TRANSITING_KEPID);
            int threads = 6;
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            List<Future<PredictionResult>> results = new ArrayList<>();

            for (int t = 0; t < threads; t++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return service.analyze(source, KoiParams.complete());
                }));
            }
            start.countDown();

            for (Future<PredictionResult> f : results) {
                assertThat(f.get(30, TimeUnit.SECONDS).predictedLabel()).isEqualTo(Classification.CONFIRMED);
            }
            executor.shutdown();
            assertThat(downloadCount(TRANSITING_KEPID)).isEqualTo(1);
        }

        @Test
        @DisplayName("an expired cache entry triggers a fresh download")
        void ttlExpiry() {
            ArchiveLightCurve source = new ArchiveLightCurve(TRANSITING_KEPID);
            service.analyze(source, KoiParams.complete());

            clock.advance(Duration.ofHours(25));
            service.analyze(source, KoiParams.complete());

            assertThat(downloadCount(TRANSITING_KEPID)).isEqualTo(2);
        }

        @Test
        @DisplayName("an explicit context is used instead of the default one")
        void explicitContext() {
            InferenceContext other = context.withClassifier("v2.0", new FixedClassifier(0.9, 0.05, 0.05));

            PredictionResult result = service.analyze(new ArchiveLightCurve(TRANSITING_KEPID), KoiParams.complete(), other);

            assertThat(result.predictedLabel()).isEqualTo(Classification.FALSE_POSITIVE);
            assertThat(result.modelVersion()).isEqualTo("v2.0");
        }

        @Test
        @DisplayName("a null parameter map is MissingFeatureError, not a crash")
        void nullParams() {
            ArchiveLightCurve source = new ArchiveLightCurve(TRANSITING_KEPID);

            assertThatThrownBy(() -> service.analyze(source, null))
                    .isInstanceOf(MissingFeatureException.class);
            assertThatThrownBy(() -> service.analyze(source, null, context))
                    .isInstanceOf(MissingFeatureException.class);
            List<BatchItemResult> batch = service.analyzeBatch(List.of(new AnalysisRequest(source, null)));
            assertThat(batch.get(0).error().kind()).isEqualTo("MissingFeatureError");
        }

        @Test
        @DisplayName("batch analysis reports each failure next to the successes, in request order")
        void batch() {
            List<AnalysisRequest> requests = List.of(
                    new AnalysisRequest(new ArchiveLightCurve(TRANSITING_KEPID), KoiParams.complete()),
                    new AnalysisRequest(new ArchiveLightCurve(MISSING_KEPID), KoiParams.complete()),
                    new AnalysisRequest(new ArchiveLightCurve(SLOW_KEPID), KoiParams.complete()),
                    new AnalysisRequest(new ArchiveLightCurve(TRANSITING_KEPID), Map.of()));

            List<BatchItemResult> results = service.analyzeBatch(requests);

            assertThat(results).extracting(BatchItemResult::sourceId)
                    .containsExactly("kic:757450", "kic:1", "kic:2", "kic:757450");
            assertThat(results.get(0).isSuccess()).isTrue();
            assertThat(results.get(1).error().kind()).isEqualTo("DataFormatError");
            assertThat(results.get(2).error().kind()).isEqualTo("TimeoutError");
            assertThat(results.get(3).error().kind()).isEqualTo("MissingFeatureError");
        }
    }

    @Nested
    @DisplayName("Signal analyses")
    class Signals {

        @Test
        @DisplayName("transit search on a downloaded source finds the injected planet")
        void detectsTransit() {
            List<TransitCandidate> detected = service.detectTransits(new ArchiveLightCurve(TRANSITING_KEPID), 0.5, 10.0, 7.0);

            assertThat(detected).hasSize(1);
            assertThat(detected.get(0).period()).isCloseTo(3.52, within(0.0352));
        }

        @Test
        @DisplayName("a failing sub-analysis does not hide the others")
        void partialResults() {
            SignalAnalysisReport report = service.analyzeSignals(new ArchiveLightCurve(TRANSITING_KEPID),
                    5.0, 1.0, 7.0, 5.0);

            assertThat(report.isComplete()).isFalse();
            assertThat(report.transits().isOk()).isFalse();
            assertThat(report.transits().error().kind()).isEqualTo("InvalidParameterError");
            assertThat(report.periodogram().isOk()).isTrue();
            assertThat(report.anomalies().isOk()).isTrue();
        }

        @Test
        @DisplayName("an unexpected engine failure is recorded in its own slot")
        void unexpectedFailureIsolated() {
            LombScarglePeriodogram broken = new LombScarglePeriodogram(5, 20000) {
                @Override
                public PeriodogramResult compute(LightCurveSeries series) {
                    throw new IllegalStateException("frequency grid exhausted");
                }
            };
            LightCurveAnalysisService withBrokenPeriodogram = newService(broken);

            SignalAnalysisReport report = withBrokenPeriodogram.analyzeSignals(new ArchiveLightCurve(TRANSITING_KEPID),
                    0.5, 10.0, 7.0, 5.0);

            assertThat(report.periodogram().isOk()).isFalse();
            assertThat(report.periodogram().error().kind()).isEqualTo("InternalError");
            assertThat(report.periodogram().error().message()).isEqualTo("frequency grid exhausted");
            assertThat(report.transits().isOk()).isTrue();
            assertThat(report.transits().value().detected()).hasSize(1);
            assertThat(report.anomalies().isOk()).isTrue();
        }

        @Test
        @DisplayName("uploaded bytes are analyzed without touching the archive")
        void uploadedSource() {
            LightCurveSeries sine = SyntheticLightCurves.sinusoid(3L, 1500, 30.0, 0.0005, 2.2, 0.01);
            UploadedLightCurve upload = UploadedLightCurve.ofText("sine.csv", SyntheticLightCurves.csv(sine, 500.0, 99L));

            double best = service.periodogram(upload).bestPeriod();

            assertThat(best).isCloseTo(2.2, within(0.022));
            assertThat(downloads).isEmpty();
        }

        @Test
        @DisplayName("phase-folding and anomaly detection accept a source")
        void foldAndAnomalies() {
            LightCurveSource source = new ArchiveLightCurve(TRANSITING_KEPID);

            PhaseFoldResult fold = service.phaseFold(source, 3.52, 1.3);
            List<AnomalyPoint> anomalies = service.detectAnomalies(source, null);

            assertThat(fold.size()).isEqualTo(4000);
            // in-transit points sit 20 sigma below the running median
            assertThat(anomalies).isNotEmpty();
            assertThat(anomalies).allSatisfy(a -> assertThat(a.flux()).isLessThan(0.99));
        }
    }

    @Nested
    @DisplayName("Plots")
    class Plots {

        @Test
        @DisplayName("visualize overlays detected transits")
        void visualize() {
            LightCurvePlot plot = service.visualize(new ArchiveLightCurve(TRANSITING_KEPID));

            assertThat(plot.sourcePoints()).isEqualTo(4000);
            assertThat(plot.transitWindows()).hasSizeGreaterThan(20);
        }

        @Test
        @DisplayName("compare keeps per-source errors")
        void compare() {
            List<ComparisonEntry> entries = service.compare(
                    List.of(new ArchiveLightCurve(TRANSITING_KEPID), new ArchiveLightCurve(MISSING_KEPID)),
                    Arrays.asList("planet", null));

            assertThat(entries).extracting(ComparisonEntry::label).containsExactly("planet", "kic:1");
            assertThat(entries.get(0).isOk()).isTrue();
            assertThat(entries.get(1).error().kind()).isEqualTo("DataFormatError");
        }

        @Test
        @DisplayName("a missing archive entry propagates as DataFormatError from single operations")
        void missingSource() {
            assertThatThrownBy(() -> service.visualize(new ArchiveLightCurve(MISSING_KEPID)))
                    .isInstanceOf(DataFormatException.class);
        }
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
