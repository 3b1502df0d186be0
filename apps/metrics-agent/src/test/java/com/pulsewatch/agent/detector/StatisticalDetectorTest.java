package com.pulsewatch.agent.detector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.pulsewatch.agent.model.Anomaly;
import com.pulsewatch.agent.model.AnomalyType;
import com.pulsewatch.agent.model.MetricFixtures;
import com.pulsewatch.agent.model.Severity;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StatisticalDetectorTest {

    private final StatisticalDetector detector = new StatisticalDetector();
    private final DetectorConfig config = DetectorConfig.defaults();

    @Test
    void flagsOutlierWithZScore() {
        List<Anomaly> anomalies = detector.detect(MetricFixtures.series("cpu", 10, 10, 11, 9, 10, 14), config);

        assertThat(anomalies).singleElement().satisfies(outlier -> {
            assertThat(outlier.anomalyType()).isEqualTo(AnomalyType.STATISTICAL_OUTLIER);
            assertThat(outlier.severity()).isEqualTo(Severity.CRITICAL);
            assertThat((double) outlier.metadata().get("z_score")).isCloseTo(5.66, within(0.01));
            assertThat((double) outlier.metadata().get("std")).isCloseTo(0.707, within(0.001));
            assertThat(outlier.metadata()).containsEntry("mean", 10.0).containsEntry("detection_method", "z_score+iqr");
            assertThat(outlier.expectedValue()).isEqualTo(10.0);
            assertThat(outlier.confidence()).isCloseTo(5.657 / 6, within(0.001));
        });
    }

    @Test
    void reportsIqrBounds() {
        Anomaly outlier = detector.detect(MetricFixtures.series("cpu", 10, 10, 11, 9, 10, 14), config).get(0);

        @SuppressWarnings("unchecked")
        Map<String, Object> bounds = (Map<String, Object>) outlier.metadata().get("iqr_bounds");
        assertThat(bounds).containsEntry("lower", 10.0).containsEntry("upper", 10.0);
        assertThat(outlier.metadata()).containsEntry("q1", 10.0).containsEntry("q3", 10.0);
    }

    @Test
    void iqrAloneCanFlagAPoint() {
        List<Anomaly> anomalies = detector.detect(MetricFixtures.series("queue", 0, 0, 0, 0, 0, 0, 0, 0, 100, 5), config);

        assertThat(anomalies).singleElement().satisfies(outlier -> {
            assertThat(outlier.metadata()).containsEntry("detection_method", "iqr");
            assertThat(outlier.confidence()).isEqualTo(0.8);
            assertThat(outlier.severity()).isEqualTo(Severity.LOW);
        });
    }

    @Test
    void ignoresPointsWithinBounds() {
        assertThat(detector.detect(MetricFixtures.series("cpu", 10, 12, 11, 9, 10, 11), config)).isEmpty();
    }

    @Test
    void constantBaselineYieldsNothing() {
        assertThat(detector.detect(MetricFixtures.series("cpu", 5, 5, 5, 5, 50), config)).isEmpty();
    }

    @Test
    void needsTwoBaselinePoints() {
        assertThat(detector.detect(MetricFixtures.series("cpu", 5, 50), config)).isEmpty();
    }

    @Test
    void trailingBaselineWindowIgnoresOlderPoints() {
        double[] values = {100, 100, 10, 10, 11, 14};

        assertThat(detector.detect(MetricFixtures.series("cpu", values), config)).isEmpty();

        DetectorConfig trailing = DetectorConfig.builder().statisticalBaselinePoints(3).build();
        assertThat(detector.detect(MetricFixtures.series("cpu", values), trailing))
                .singleElement()
                .satisfies(outlier -> assertThat((double) outlier.metadata().get("mean")).isCloseTo(10.333, within(0.001)));
    }

    @Test
    void higherThresholdsSuppressModerateOutliers() {
        double[] values = {10, 12, 11, 9, 10, 14};
        DetectorConfig lenient = DetectorConfig.builder().zscoreThreshold(4).iqrMultiplier(3).build();

        assertThat(detector.detect(MetricFixtures.series("cpu", values), config)).hasSize(1);
        assertThat(detector.detect(MetricFixtures.series("cpu", values), lenient)).isEmpty();
    }
}
