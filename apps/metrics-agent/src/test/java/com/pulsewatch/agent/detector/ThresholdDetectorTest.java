package com.pulsewatch.agent.detector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pulsewatch.agent.model.Anomaly;
import com.pulsewatch.agent.model.AnomalyType;
import com.pulsewatch.agent.model.MetricFixtures;
import com.pulsewatch.agent.model.Severity;
import java.util.List;
import org.junit.jupiter.api.Test;

class ThresholdDetectorTest {

    private final ThresholdDetector detector = new ThresholdDetector();

    @Test
    void criticalBoundaryIsInclusive() {
        DetectorConfig config = withRule(ThresholdRule.upper(1000.0, 5000.0));

        List<Anomaly> anomalies = detector.detect(MetricFixtures.series("queue_depth", 10, 5000), config);

        assertThat(anomalies).singleElement().satisfies(breach -> {
            assertThat(breach.anomalyType()).isEqualTo(AnomalyType.THRESHOLD_BREACH);
            assertThat(breach.severity()).isEqualTo(Severity.CRITICAL);
            assertThat(breach.expectedValue()).isEqualTo(5000.0);
            assertThat(breach.confidence()).isEqualTo(1.0);
            assertThat(breach.metadata())
                    .containsEntry("threshold_type", "critical")
                    .containsEntry("direction", "upper")
                    .containsEntry("excess", 0.0);
        });
    }

    @Test
    void warningBreachIsHigh() {
        DetectorConfig config = withRule(ThresholdRule.upper(1000.0, 5000.0));

        assertThat(detector.detect(MetricFixtures.series("queue_depth", 10, 1000), config))
                .singleElement()
                .satisfies(breach -> {
                    assertThat(breach.severity()).isEqualTo(Severity.HIGH);
                    assertThat(breach.metadata()).containsEntry("threshold_type", "warning");
                });
        assertThat(detector.detect(MetricFixtures.series("queue_depth", 10, 999.9), config)).isEmpty();
    }

    @Test
    void onlyLatestPointCounts() {
        DetectorConfig config = withRule(ThresholdRule.upper(1000.0, 5000.0));

        assertThat(detector.detect(MetricFixtures.series("queue_depth", 9000, 10), config)).isEmpty();
    }

    @Test
    void lowerBoundBreachesBelow() {
        DetectorConfig config = withRule(ThresholdRule.lower(20.0, 5.0));

        assertThat(detector.detect(MetricFixtures.series("free_disk_gb", 30, 4), config))
                .singleElement()
                .satisfies(breach -> {
                    assertThat(breach.severity()).isEqualTo(Severity.CRITICAL);
                    assertThat(breach.metadata()).containsEntry("direction", "lower").containsEntry("excess", 1.0);
                });
        assertThat(detector.detect(MetricFixtures.series("free_disk_gb", 30, 20), config))
                .singleElement()
                .satisfies(breach -> assertThat(breach.severity()).isEqualTo(Severity.HIGH));
        assertThat(detector.detect(MetricFixtures.series("free_disk_gb", 30, 21), config)).isEmpty();
    }

    @Test
    void criticalOnlyRule() {
        DetectorConfig config = withRule(ThresholdRule.upper(null, 90.0));

        assertThat(detector.detect(MetricFixtures.series("cpu", 10, 89), config)).isEmpty();
        assertThat(detector.detect(MetricFixtures.series("cpu", 10, 95), config)).hasSize(1);
    }

    @Test
    void noRuleMeansNoAnomaly() {
        assertThat(detector.detect(MetricFixtures.series("cpu", 10, 1e9), DetectorConfig.defaults())).isEmpty();
    }

    @Test
    void rejectsRulesOutOfOrder() {
        assertThatThrownBy(() -> ThresholdRule.upper(6000.0, 5000.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ThresholdRule.lower(5.0, 20.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ThresholdRule(null, null, ThresholdDirection.UPPER))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private DetectorConfig withRule(ThresholdRule rule) {
        return DetectorConfig.builder().thresholdRule(rule).build();
    }
}
