package com.pulsewatch.agent.detector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pulsewatch.agent.baseline.SeasonalGranularity;
import org.junit.jupiter.api.Test;

class DetectorConfigTest {

    @Test
    void defaultsEnableEverything() {
        DetectorConfig config = DetectorConfig.defaults();

        assertThat(config.enabledDetectors()).containsExactlyInAnyOrder(DetectorKind.values());
        assertThat(config.minChangePercent()).isEqualTo(50.0);
        assertThat(config.zscoreThreshold()).isEqualTo(2.0);
        assertThat(config.seasonalTolerance()).isEqualTo(0.5);
        assertThat(config.seasonalGranularity()).isEqualTo(SeasonalGranularity.HOUR_OF_WEEK);
        assertThat(config.thresholdRule()).isNull();
        assertThat(config.movingAverageWindow()).isEqualTo(24);
        assertThat(config.movingAverageSigma()).isEqualTo(2.5);
    }

    @Test
    void toBuilderKeepsValues() {
        DetectorConfig config = DetectorConfig.builder()
                .onlyEnabled(DetectorKind.SPIKE)
                .minChangePercent(75)
                .build();

        DetectorConfig copy = config.toBuilder().enabled(DetectorKind.PATTERN, true).build();

        assertThat(copy.minChangePercent()).isEqualTo(75.0);
        assertThat(copy.isEnabled(DetectorKind.SPIKE)).isTrue();
        assertThat(copy.isEnabled(DetectorKind.PATTERN)).isTrue();
        assertThat(copy.isEnabled(DetectorKind.THRESHOLD)).isFalse();
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> DetectorConfig.builder().zscoreThreshold(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DetectorConfig.builder().minChangePercent(-5).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DetectorConfig.builder().seasonalTolerance(-0.1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DetectorConfig.builder().iqrMultiplier(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DetectorConfig.builder().patternMinPoints(3).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DetectorConfig.builder().movingAverageWindow(1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("moving_average_window");
        assertThatThrownBy(() -> DetectorConfig.builder().movingAverageSigma(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(DetectorConfig.builder().movingAverageWindow(0).build().movingAverageWindow()).isZero();
    }
}
