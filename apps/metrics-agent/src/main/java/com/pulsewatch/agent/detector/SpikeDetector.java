package com.pulsewatch.agent.detector;

import com.pulsewatch.agent.model.Anomaly;
import com.pulsewatch.agent.model.AnomalyType;
import com.pulsewatch.agent.model.Metric;
import com.pulsewatch.agent.model.MetricPoint;
import com.pulsewatch.agent.model.Severity;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Compares the latest point with the mean of the few points right before it.
 */
@Component
public class SpikeDetector implements Detector {

    static final double MAX_CONFIDENCE = 0.95;

    @Override
    public DetectorKind kind() {
        return DetectorKind.SPIKE;
    }

    @Override
    public List<Anomaly> detect(Metric metric, DetectorConfig config) {
        if (!metric.hasSufficientData()) {
            return List.of();
        }
        double[] values = metric.values();
        int last = values.length - 1;
        int baselinePoints = Math.min(config.spikeBaselinePoints(), last);
        double baseline = Statistics.mean(values, last - baselinePoints, last);
        double current = values[last];
        if (!Double.isFinite(current) || !Double.isFinite(baseline)) {
            return List.of();
        }
        MetricPoint point = metric.points().get(last);

        if (baseline == 0.0) {
            return current == 0.0 ? List.of() : List.of(fromZeroBaseline(metric, point, baselinePoints));
        }

        double trigger = config.minChangePercent() / 100.0;
        double ratio = current / baseline;
        AnomalyType type;
        double change;
        double magnitude;
        if (ratio - 1 >= trigger) {
            type = AnomalyType.SPIKE;
            change = ratio - 1;
            magnitude = ratio;
        } else if (1 - ratio >= trigger) {
            type = AnomalyType.DROP;
            change = 1 - ratio;
            magnitude = ratio <= 0 ? Double.POSITIVE_INFINITY : 1 / ratio;
        } else {
            return List.of();
        }

        double excess = change - trigger;
        double confidence = Double.isFinite(excess)
                ? Math.min(MAX_CONFIDENCE, 0.5 + 0.45 * excess / (trigger + excess))
                : MAX_CONFIDENCE;
        double deviation = (ratio - 1) * 100;
        String description = type == AnomalyType.SPIKE
                ? String.format(Locale.ROOT, "Spike detected: %.2f -> %.2f (+%.1f%%)", baseline, current, deviation)
                : String.format(Locale.ROOT, "Drop detected: %.2f -> %.2f (%.1f%%)", baseline, current, deviation);

        return List.of(Anomaly.builder()
                .metric(metric)
                .anomalyType(type)
                .severity(severityFor(magnitude))
                .value(current)
                .expectedValue(baseline)
                .deviation(deviation)
                .confidence(confidence)
                .timestamp(point.timestamp())
                .description(description)
                .meta("spike_ratio", ratio)
                .meta("previous_value", baseline)
                .meta("current_value", current)
                .meta("baseline_points", baselinePoints)
                .detectorName(name())
                .build());
    }

    static Severity severityFor(double magnitude) {
        if (magnitude >= 3.0) {
            return Severity.CRITICAL;
        }
        if (magnitude >= 2.0) {
            return Severity.HIGH;
        }
        if (magnitude >= 1.5) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    // A move away from a zero baseline has no finite ratio; report it at the top tier as a 100% change.
    private Anomaly fromZeroBaseline(Metric metric, MetricPoint point, int baselinePoints) {
        AnomalyType type = point.value() > 0 ? AnomalyType.SPIKE : AnomalyType.DROP;
        return Anomaly.builder()
                .metric(metric)
                .anomalyType(type)
                .severity(Severity.CRITICAL)
                .value(point.value())
                .expectedValue(0.0)
                .deviation(type == AnomalyType.SPIKE ? 100.0 : -100.0)
                .confidence(MAX_CONFIDENCE)
                .timestamp(point.timestamp())
                .description(String.format(Locale.ROOT, "%s detected: 0.00 -> %.2f from a zero baseline",
                        type == AnomalyType.SPIKE ? "Spike" : "Drop", point.value()))
                .meta("zero_baseline", true)
                .meta("previous_value", 0.0)
                .meta("current_value", point.value())
                .meta("baseline_points", baselinePoints)
                .detectorName(name())
                .build();
    }
}
