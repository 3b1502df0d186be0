package com.pulsewatch.agent.detector;

import com.pulsewatch.agent.model.Anomaly;
import com.pulsewatch.agent.model.AnomalyType;
import com.pulsewatch.agent.model.Metric;
import com.pulsewatch.agent.model.MetricPoint;
import com.pulsewatch.agent.model.Severity;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class ThresholdDetector implements Detector {

    @Override
    public DetectorKind kind() {
        return DetectorKind.THRESHOLD;
    }

    @Override
    public List<Anomaly> detect(Metric metric, DetectorConfig config) {
        ThresholdRule rule = config.thresholdRule();
        if (rule == null || !metric.hasSufficientData()) {
            return List.of();
        }
        MetricPoint latest = metric.latest().orElseThrow();
        double value = latest.value();
        if (Double.isNaN(value)) {
            return List.of();
        }
        ThresholdDirection direction = rule.direction();
        if (rule.critical() != null && direction.breaches(value, rule.critical())) {
            return List.of(breach(metric, latest, rule.critical(), "critical", Severity.CRITICAL, direction));
        }
        if (rule.warning() != null && direction.breaches(value, rule.warning())) {
            return List.of(breach(metric, latest, rule.warning(), "warning", Severity.HIGH, direction));
        }
        return List.of();
    }

    private Anomaly breach(Metric metric, MetricPoint point, double threshold, String thresholdType,
                           Severity severity, ThresholdDirection direction) {
        double excess = direction == ThresholdDirection.UPPER ? point.value() - threshold : threshold - point.value();
        String position = direction == ThresholdDirection.UPPER ? "above" : "below";
        String description = String.format(Locale.ROOT,
                "%s threshold breached: value %.2f is %s threshold %.2f",
                thresholdType.toUpperCase(Locale.ROOT), point.value(), position, threshold);
        return Anomaly.builder()
                .metric(metric)
                .anomalyType(AnomalyType.THRESHOLD_BREACH)
                .severity(severity)
                .value(point.value())
                .expectedValue(threshold)
                .confidence(1.0)
                .timestamp(point.timestamp())
                .description(description)
                .meta("threshold_type", thresholdType)
                .meta("threshold", threshold)
                .meta("direction", direction.name().toLowerCase(Locale.ROOT))
                .meta("excess", excess)
                .detectorName(name())
                .build();
    }
}
