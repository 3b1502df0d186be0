package com.pulsewatch.agent.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.pulsewatch.agent.baseline.BaselineCache;
import com.pulsewatch.agent.baseline.BaselineObservation;
import com.pulsewatch.agent.config.AgentProperties;
import com.pulsewatch.agent.config.DetectorSettings;
import com.pulsewatch.agent.detector.Detector;
import com.pulsewatch.agent.detector.DetectorConfig;
import com.pulsewatch.agent.detector.DetectorKind;
import com.pulsewatch.agent.detector.DetectorRegistry;
import com.pulsewatch.agent.detector.PatternDetector;
import com.pulsewatch.agent.detector.SpikeDetector;
import com.pulsewatch.agent.detector.StatisticalDetector;
import com.pulsewatch.agent.detector.ThresholdDetector;
import com.pulsewatch.agent.forward.ForwardResult;
import com.pulsewatch.agent.model.Anomaly;
import com.pulsewatch.agent.model.AnomalyType;
import com.pulsewatch.agent.model.Metric;
import com.pulsewatch.agent.model.MetricFixtures;
import com.pulsewatch.agent.model.Severity;
import com.pulsewatch.agent.prometheus.FetchException;
import com.pulsewatch.agent.prometheus.MetricFetcher;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class DetectionPipelineTest {

    private static final Clock CLOCK = Clock.fixed(MetricFixtures.at(30), ZoneOffset.UTC);

    private static final Map<String, double[]> SERIES = Map.of(
            "cpu", new double[] {10, 10, 11, 9, 10, 14},
            "memory", new double[] {100, 101, 99, 100, 100, 100});

    private final BaselineCache baselineCache = new BaselineCache();
    private final List<List<Anomaly>> forwardedBatches = new CopyOnWriteArrayList<>();
    private final MetricFetcher seriesFetcher =
            (query, start, end, step) -> MetricFixtures.series(query.name(), SERIES.get(query.name()));

    private DetectionPipeline pipeline;

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.shutdown();
        }
    }

    @Test
    void failingDetectorDoesNotAffectOthers() {
        Detector broken = new Detector() {
            @Override
            public DetectorKind kind() {
                return DetectorKind.SPIKE;
            }

            @Override
            public List<Anomaly> detect(Metric metric, DetectorConfig config) {
                throw new IllegalStateException("boom");
            }
        };
        pipeline = pipeline(seriesFetcher, List.of(new ThresholdDetector(), broken, new StatisticalDetector()));

        CycleReport report = pipeline.runManualCycle(List.of(), false);

        assertThat(report.detectorFailures()).containsExactlyInAnyOrder(
                new DetectorFailure("cpu", "spike_detector", "boom"),
                new DetectorFailure("memory", "spike_detector", "boom"));
        assertThat(report.anomalies()).extracting(Anomaly::metricName, Anomaly::anomalyType)
                .containsExactly(tuple("cpu", AnomalyType.STATISTICAL_OUTLIER));
        assertThat(report.metricsAnalyzed()).isEqualTo(2);
    }

    @Test
    void detectorErrorIsRecordedAsFailure() {
        Detector overflowing = new Detector() {
            @Override
            public DetectorKind kind() {
                return DetectorKind.PATTERN;
            }

            @Override
            public List<Anomaly> detect(Metric metric, DetectorConfig config) {
                throw new StackOverflowError("too deep");
            }

            @Override
            public Optional<BaselineObservation> observe(Metric metric, DetectorConfig config) {
                throw new AssertionError("bad window");
            }
        };
        pipeline = pipeline(seriesFetcher, List.of(new StatisticalDetector(), overflowing));

        CycleReport report = pipeline.runManualCycle(null, false);

        assertThat(report.detectorFailures()).containsExactlyInAnyOrder(
                new DetectorFailure("cpu", "pattern_detector", "too deep"),
                new DetectorFailure("memory", "pattern_detector", "too deep"));
        assertThat(report.anomalies()).extracting(Anomaly::metricName, Anomaly::anomalyType)
                .containsExactly(tuple("cpu", AnomalyType.STATISTICAL_OUTLIER));
        assertThat(pipeline.state()).isEqualTo(CycleState.IDLE);
    }

    @Test
    void criticalThresholdBreachSkipsRemainingDetectors() {
        DetectorSettings cpuCritical = new DetectorSettings(
                new DetectorSettings.Threshold(null, 12.0, 13.0, null), null, null, null);

        pipeline = pipeline(seriesFetcher, defaultDetectors(), Duration.ofSeconds(5), true, cpuCritical);
        CycleReport shortCircuited = pipeline.runManualCycle(List.of("cpu"), false);

        assertThat(shortCircuited.anomalies()).extracting(Anomaly::anomalyType, Anomaly::severity)
                .containsExactly(tuple(AnomalyType.THRESHOLD_BREACH, Severity.CRITICAL));
        pipeline.shutdown();

        pipeline = pipeline(seriesFetcher, defaultDetectors(), Duration.ofSeconds(5), false, cpuCritical);
        CycleReport full = pipeline.runManualCycle(List.of("cpu"), false);

        assertThat(full.anomalies()).extracting(Anomaly::anomalyType)
                .contains(AnomalyType.THRESHOLD_BREACH, AnomalyType.STATISTICAL_OUTLIER);
    }

    @Test
    void hungFetchTimesOutWithoutHoldingUpOtherMetrics() {
        CountDownLatch release = new CountDownLatch(1);
        MetricFetcher hanging = (query, start, end, step) -> {
            if (query.name().equals("memory")) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return seriesFetcher.fetch(query, start, end, step);
        };
        pipeline = pipeline(hanging, defaultDetectors(), Duration.ofMillis(200), false, DetectorSettings.none());

        try {
            long startedAt = System.nanoTime();
            CycleReport report = pipeline.runManualCycle(null, false);

            assertThat(Duration.ofNanos(System.nanoTime() - startedAt)).isLessThan(Duration.ofSeconds(5));
            assertThat(report.failedMetrics()).containsExactly("memory");
            assertThat(report.metricsAnalyzed()).isEqualTo(1);
            assertThat(report.anomalies()).isNotEmpty().allSatisfy(a -> assertThat(a.metricName()).isEqualTo("cpu"));
            assertThat(pipeline.state()).isEqualTo(CycleState.IDLE);
        } finally {
            release.countDown();
        }
    }

    @Test
    void fetchFailureSkipsOnlyThatMetric() {
        MetricFetcher flaky = (query, start, end, step) -> {
            if (query.name().equals("memory")) {
                throw new FetchException("memory", "connection refused");
            }
            return seriesFetcher.fetch(query, start, end, step);
        };
        pipeline = pipeline(flaky, defaultDetectors());

        CycleReport report = pipeline.runManualCycle(null, false);

        assertThat(report.failedMetrics()).containsExactly("memory");
        assertThat(report.metricsRequested()).isEqualTo(2);
        assertThat(report.metricsAnalyzed()).isEqualTo(1);
        assertThat(report.anomalies()).isNotEmpty().allSatisfy(a -> assertThat(a.metricName()).isEqualTo("cpu"));
        assertThat(pipeline.state()).isEqualTo(CycleState.IDLE);
    }

    @Test
    void detectionIsRepeatableOnTheSameWindows() {
        pipeline = pipeline(seriesFetcher, defaultDetectors());
        List<Metric> metrics = List.of(
                MetricFixtures.series("cpu", SERIES.get("cpu")),
                MetricFixtures.series("memory", SERIES.get("memory")));

        DetectionPipeline.DetectionOutcome first = pipeline.detectAll(metrics);
        DetectionPipeline.DetectionOutcome second = pipeline.detectAll(metrics);

        assertThat(second.anomalies())
                .usingRecursiveFieldByFieldElementComparatorIgnoringFields("anomalyId")
                .containsExactlyInAnyOrderElementsOf(first.anomalies());
        assertThat(baselineCache.generation()).isZero();
        assertThat(second.observations()).hasSize(2);
    }

    @Test
    void baselineIsCommittedOnceAfterTheCycle() {
        pipeline = pipeline(seriesFetcher, defaultDetectors());

        pipeline.runManualCycle(List.of("cpu"), false);

        assertThat(baselineCache.generation()).isEqualTo(1);
        assertThat(baselineCache.snapshot()).hasSize(1);
        assertThat(baselineCache.snapshot().keySet()).singleElement()
                .satisfies(key -> assertThat(key.metricName()).isEqualTo("cpu"));
    }

    @Test
    void resultsAreSortedByMetricTypeAndTime() {
        pipeline = pipeline(seriesFetcher, defaultDetectors());

        CycleReport report = pipeline.runManualCycle(null, false);

        assertThat(report.anomalies()).isSortedAccordingTo(DetectionPipeline.OUTPUT_ORDER);
        assertThat(pipeline.lastReport()).contains(report);
    }

    @Test
    void scheduledCyclesForwardAndSuppressRepeats() {
        pipeline = pipeline(seriesFetcher, defaultDetectors());

        CycleReport first = pipeline.runScheduledCycle().orElseThrow();
        CycleReport second = pipeline.runScheduledCycle().orElseThrow();

        assertThat(first.forwarded()).isTrue();
        assertThat(forwardedBatches).hasSize(1);
        assertThat(forwardedBatches.get(0)).isEqualTo(first.anomalies());
        assertThat(second.forwarded()).isFalse();
        assertThat(second.anomalies()).isEmpty();
        assertThat(second.alreadyForwarded()).isEqualTo(first.anomalies().size());
    }

    @Test
    void manualCycleDoesNotForwardByDefault() {
        pipeline = pipeline(seriesFetcher, defaultDetectors());

        CycleReport report = pipeline.runManualCycle(List.of("cpu"), false);

        assertThat(report.anomalies()).isNotEmpty();
        assertThat(report.forwarded()).isFalse();
        assertThat(forwardedBatches).isEmpty();
    }

    @Test
    void rejectsUnknownMetrics() {
        pipeline = pipeline(seriesFetcher, defaultDetectors());

        assertThatThrownBy(() -> pipeline.runManualCycle(List.of("cpu", "disk"), false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("disk");
    }

    @Test
    void overlappingCyclesAreRejected() throws Exception {
        CountDownLatch fetchStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        MetricFetcher blocking = (query, start, end, step) -> {
            fetchStarted.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return seriesFetcher.fetch(query, start, end, step);
        };
        pipeline = pipeline(blocking, defaultDetectors());

        CompletableFuture<CycleReport> running = CompletableFuture.supplyAsync(() -> pipeline.runManualCycle(null, false));
        assertThat(fetchStarted.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(pipeline.state()).isEqualTo(CycleState.FETCHING);
        assertThatThrownBy(() -> pipeline.runManualCycle(null, false)).isInstanceOf(CycleInProgressException.class);
        assertThat(pipeline.runScheduledCycle()).isEmpty();

        release.countDown();
        assertThat(running.get(10, TimeUnit.SECONDS).failedMetrics()).isEmpty();
        assertThat(pipeline.state()).isEqualTo(CycleState.IDLE);
    }

    private List<Detector> defaultDetectors() {
        return List.of(new ThresholdDetector(), new SpikeDetector(), new StatisticalDetector(),
                new PatternDetector(baselineCache));
    }

    private DetectionPipeline pipeline(MetricFetcher fetcher, List<Detector> detectors) {
        return pipeline(fetcher, detectors, Duration.ofSeconds(5), false, DetectorSettings.none());
    }

    private DetectionPipeline pipeline(MetricFetcher fetcher, List<Detector> detectors, Duration fetchTimeout,
            boolean shortCircuit, DetectorSettings cpuSettings) {
        AgentProperties properties = new AgentProperties(
                new AgentProperties.Agent("test-agent", Duration.ofMinutes(1), null, null, null,
                        fetchTimeout, 2, shortCircuit, false),
                null, null, null, null, null,
                List.of(new AgentProperties.MonitoredMetric("cpu", null, null, cpuSettings),
                        new AgentProperties.MonitoredMetric("memory", null, null, DetectorSettings.none())));
        DetectorRegistry registry = new DetectorRegistry(properties, detectors);
        return new DetectionPipeline(properties, fetcher, registry, baselineCache, new AnomalyDeduplicator(),
                (anomalies, timeout) -> anomalies,
                anomalies -> {
                    forwardedBatches.add(anomalies);
                    return CompletableFuture.completedFuture(ForwardResult.DELIVERED);
                },
                CLOCK);
    }
}
