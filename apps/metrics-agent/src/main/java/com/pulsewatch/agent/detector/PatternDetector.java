package com.pulsewatch.agent.detector;

import com.pulsewatch.agent.baseline.BaselineCache;
import com.pulsewatch.agent.baseline.BaselineKey;
import com.pulsewatch.agent.baseline.BaselineObservation;
import com.pulsewatch.agent.baseline.SeasonalBaseline;
import com.pulsewatch.agent.model.Anomaly;
import com.pulsewatch.agent.model.AnomalyType;
import com.pulsewatch.agent.model.Metric;
import com.pulsewatch.agent.model.MetricPoint;
import com.pulsewatch.agent.model.Severity;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Compares the window against the seasonal baseline of the latest point's bucket. Buckets
 * with too few prior cycles fall back to comparing the trend of the two window halves.
 * Independently, the latest point is checked against the moving average of the points
 * before it. The cache is only read here; the pipeline commits {@link #observe} results
 * after detection.
 */
@Component
public class PatternDetector implements Detector {

    private final BaselineCache baselineCache;

    public PatternDetector(BaselineCache baselineCache) {
        this.baselineCache = baselineCache;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.PATTERN;
    }

    @Override
    public List<Anomaly> detect(Metric metric, DetectorConfig config) {
        if (!metric.hasSufficientData()) {
            return List.of();
        }
        MetricPoint latest = metric.latest().orElseThrow();
        Optional<SeasonalBaseline> baseline = baselineCache.lookup(keyFor(metric, latest, config))
                .filter(b -> b.samples() >= config.baselineMinSamples());
        List<Anomaly> anomalies = new ArrayList<>(baseline.isPresent()
                ? seasonal(metric, latest, baseline.get(), config)
                : slopeChange(metric, latest, config));
        movingAverage(metric, latest, config).ifPresent(anomalies::add);
        return anomalies;
    }

    @Override
    public Optional<BaselineObservation> observe(Metric metric, DetectorConfig config) {
        if (!metric.hasSufficientData()) {
            return Optional.empty();
        }
        double windowMean = Statistics.mean(metric.values());
        if (!Double.isFinite(windowMean)) {
            return Optional.empty();
        }
        MetricPoint latest = metric.latest().orElseThrow();
        return Optional.of(new BaselineObservation(keyFor(metric, latest, config), windowMean));
    }

    private List<Anomaly> seasonal(Metric metric, MetricPoint latest, SeasonalBaseline baseline, DetectorConfig config) {
        double windowMean = Statistics.mean(metric.values());
        double expected = baseline.mean();
        if (expected == 0 || !Double.isFinite(windowMean)) {
            return List.of();
        }
        double relativeDeviation = Math.abs(windowMean - expected) / Math.abs(expected);
        if (relativeDeviation <= config.seasonalTolerance()) {
            return List.of();
        }
        double multiples = relativeDeviation / config.seasonalTolerance();
        return List.of(Anomaly.builder()
                .metric(metric)
                .anomalyType(AnomalyType.PATTERN_ANOMALY)
                .severity(Severity.fromMagnitude(multiples))
                .value(windowMean)
                .expectedValue(expected)
                .confidence(confidenceFor(multiples))
                .timestamp(latest.timestamp())
                .description(String.format(Locale.ROOT,
                        "Seasonal deviation: window mean %.2f vs baseline %.2f for %s bucket %d (%.0f%% off)",
                        windowMean, expected, config.seasonalGranularity().name().toLowerCase(Locale.ROOT),
                        config.seasonalGranularity().bucketOf(latest.timestamp()), relativeDeviation * 100))
                .meta("pattern_method", "seasonal")
                .meta("relative_deviation", relativeDeviation)
                .meta("tolerance", config.seasonalTolerance())
                .meta("baseline_samples", baseline.samples())
                .meta("baseline_std", baseline.stdDev())
                .meta("bucket", config.seasonalGranularity().bucketOf(latest.timestamp()))
                .detectorName(name())
                .build());
    }

    private List<Anomaly> slopeChange(Metric metric, MetricPoint latest, DetectorConfig config) {
        double[] values = metric.values();
        int n = values.length;
        if (n < config.patternMinPoints()) {
            return List.of();
        }
        int half = n / 2;
        Statistics.Line first = Statistics.fit(values, 0, half);
        Statistics.Line second = Statistics.fit(values, half, n);
        double level = Math.abs(Statistics.mean(values));
        if (level == 0 || !Double.isFinite(level)) {
            return List.of();
        }
        double change = Math.abs(second.slope() - first.slope()) * (n / 2.0) / level;
        if (!(change > config.seasonalTolerance())) {
            return List.of();
        }
        double multiples = change / config.seasonalTolerance();
        double expected = first.at(n - 1);
        return List.of(Anomaly.builder()
                .metric(metric)
                .anomalyType(AnomalyType.PATTERN_ANOMALY)
                .severity(Severity.fromMagnitude(multiples))
                .value(latest.value())
                .expectedValue(expected)
                .confidence(confidenceFor(multiples))
                .timestamp(latest.timestamp())
                .startTime(metric.points().get(half).timestamp())
                .description(String.format(Locale.ROOT,
                        "Trend change: slope moved from %.4f to %.4f per point (%.0f%% of level over half a window)",
                        first.slope(), second.slope(), change * 100))
                .meta("pattern_method", "slope_change")
                .meta("first_half_slope", first.slope())
                .meta("second_half_slope", second.slope())
                .meta("slope_change", change)
                .meta("tolerance", config.seasonalTolerance())
                .detectorName(name())
                .build());
    }

    private Optional<Anomaly> movingAverage(Metric metric, MetricPoint latest, DetectorConfig config) {
        int window = config.movingAverageWindow();
        double[] values = metric.values();
        int last = values.length - 1;
        if (window == 0 || last < window || !Double.isFinite(latest.value())) {
            return Optional.empty();
        }
        double[] preceding = Arrays.copyOfRange(values, last - window, last);
        double average = Statistics.mean(preceding);
        double std = Statistics.sampleStdDev(preceding, average);
        if (std == 0 || !Double.isFinite(std)) {
            return Optional.empty();
        }
        double sigmas = Math.abs(latest.value() - average) / std;
        if (!(sigmas > config.movingAverageSigma())) {
            return Optional.empty();
        }
        return Optional.of(Anomaly.builder()
                .metric(metric)
                .anomalyType(AnomalyType.PATTERN_ANOMALY)
                .severity(movingAverageSeverity(sigmas))
                .value(latest.value())
                .expectedValue(average)
                .confidence(Math.min(0.95, sigmas / 5))
                .timestamp(latest.timestamp())
                .startTime(metric.points().get(last - window).timestamp())
                .description(String.format(Locale.ROOT,
                        "Moving-average deviation: %.2f vs %.2f over the last %d points (%.2f sigma)",
                        latest.value(), average, window, sigmas))
                .meta("pattern_method", "moving_average")
                .meta("deviation_sigma", sigmas)
                .meta("moving_average", average)
                .meta("moving_std", std)
                .meta("window", window)
                .detectorName(name())
                .build());
    }

    static Severity movingAverageSeverity(double sigmas) {
        if (sigmas > 4) {
            return Severity.HIGH;
        }
        if (sigmas > 3) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    private static double confidenceFor(double multiples) {
        return Math.min(0.95, multiples / (multiples + 1));
    }

    private static BaselineKey keyFor(Metric metric, MetricPoint latest, DetectorConfig config) {
        return new BaselineKey(metric.name(), config.seasonalGranularity(),
                config.seasonalGranularity().bucketOf(latest.timestamp()));
    }
}
