package com.pulsewatch.agent.detector;

import com.pulsewatch.agent.model.Anomaly;
import com.pulsewatch.agent.model.AnomalyType;
import com.pulsewatch.agent.model.Metric;
import com.pulsewatch.agent.model.MetricPoint;
import com.pulsewatch.agent.model.Severity;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Z-score and IQR test of the latest point against the preceding points of the window.
 */
@Component
public class StatisticalDetector implements Detector {

    private static final int MIN_BASELINE_POINTS = 2;
    private static final double IQR_ONLY_CONFIDENCE = 0.8;

    @Override
    public DetectorKind kind() {
        return DetectorKind.STATISTICAL;
    }

    @Override
    public List<Anomaly> detect(Metric metric, DetectorConfig config) {
        if (!metric.hasSufficientData()) {
            return List.of();
        }
        double[] values = metric.values();
        int last = values.length - 1;
        int from = config.statisticalBaselinePoints() > 0
                ? Math.max(0, last - config.statisticalBaselinePoints())
                : 0;
        double[] baseline = Arrays.copyOfRange(values, from, last);
        if (baseline.length < MIN_BASELINE_POINTS) {
            return List.of();
        }
        double x = values[last];
        double mean = Statistics.mean(baseline);
        double std = Statistics.sampleStdDev(baseline, mean);
        if (std == 0 || !Double.isFinite(std) || !Double.isFinite(x)) {
            return List.of();
        }

        double zScore = (x - mean) / std;
        double[] sorted = Statistics.sortedCopy(baseline);
        double q1 = Statistics.percentile(sorted, 25);
        double q3 = Statistics.percentile(sorted, 75);
        double iqr = q3 - q1;
        double lower = q1 - config.iqrMultiplier() * iqr;
        double upper = q3 + config.iqrMultiplier() * iqr;

        boolean zScoreOutlier = Math.abs(zScore) >= config.zscoreThreshold();
        boolean iqrOutlier = x < lower || x > upper;
        if (!zScoreOutlier && !iqrOutlier) {
            return List.of();
        }

        String method = zScoreOutlier && iqrOutlier ? "z_score+iqr" : zScoreOutlier ? "z_score" : "iqr";
        double confidence = zScoreOutlier ? Math.min(0.99, Math.abs(zScore) / 6.0) : IQR_ONLY_CONFIDENCE;
        Map<String, Object> bounds = new LinkedHashMap<>();
        bounds.put("lower", lower);
        bounds.put("upper", upper);
        MetricPoint point = metric.points().get(last);

        return List.of(Anomaly.builder()
                .metric(metric)
                .anomalyType(AnomalyType.STATISTICAL_OUTLIER)
                .severity(Severity.fromMagnitude(Math.abs(zScore)))
                .value(x)
                .expectedValue(mean)
                .confidence(confidence)
                .timestamp(point.timestamp())
                .description(String.format(Locale.ROOT,
                        "Statistical outlier: value %.2f is %.2f standard deviations from mean %.2f (%s)",
                        x, zScore, mean, method))
                .meta("z_score", zScore)
                .meta("iqr_bounds", bounds)
                .meta("q1", q1)
                .meta("q3", q3)
                .meta("mean", mean)
                .meta("std", std)
                .meta("detection_method", method)
                .detectorName(name())
                .build());
    }
}
