package com.pulsewatch.agent.detector;

import com.pulsewatch.agent.baseline.SeasonalGranularity;
import java.util.EnumSet;
import java.util.Set;

/**
 * Effective detector parameters for one metric. Built once at startup by the registry;
 * invalid values are rejected here so detection never sees them.
 */
public record DetectorConfig(
        Set<DetectorKind> enabledDetectors,
        double minChangePercent,
        int spikeBaselinePoints,
        double zscoreThreshold,
        double iqrMultiplier,
        int statisticalBaselinePoints,
        ThresholdRule thresholdRule,
        double seasonalTolerance,
        SeasonalGranularity seasonalGranularity,
        int baselineMinSamples,
        int patternMinPoints,
        int movingAverageWindow,
        double movingAverageSigma
) {

    public static final double DEFAULT_MIN_CHANGE_PERCENT = 50.0;
    public static final double DEFAULT_ZSCORE_THRESHOLD = 2.0;
    public static final double DEFAULT_IQR_MULTIPLIER = 1.5;
    public static final double DEFAULT_SEASONAL_TOLERANCE = 0.5;
    public static final int DEFAULT_MOVING_AVERAGE_WINDOW = 24;
    public static final double DEFAULT_MOVING_AVERAGE_SIGMA = 2.5;

    public DetectorConfig {
        enabledDetectors = enabledDetectors == null || enabledDetectors.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(enabledDetectors));
        if (!(minChangePercent > 0)) {
            throw new IllegalArgumentException("min_change_percent must be positive, got " + minChangePercent);
        }
        if (spikeBaselinePoints < 1) {
            throw new IllegalArgumentException("spike baseline_points must be at least 1");
        }
        if (!(zscoreThreshold > 0)) {
            throw new IllegalArgumentException("zscore_threshold must be positive, got " + zscoreThreshold);
        }
        if (!(iqrMultiplier > 0)) {
            throw new IllegalArgumentException("iqr_multiplier must be positive, got " + iqrMultiplier);
        }
        if (statisticalBaselinePoints < 0) {
            throw new IllegalArgumentException("statistical baseline_points must not be negative");
        }
        if (!(seasonalTolerance > 0)) {
            throw new IllegalArgumentException("seasonal_tolerance must be positive, got " + seasonalTolerance);
        }
        if (seasonalGranularity == null) {
            seasonalGranularity = SeasonalGranularity.HOUR_OF_WEEK;
        }
        if (baselineMinSamples < 1) {
            throw new IllegalArgumentException("baseline_min_samples must be at least 1");
        }
        if (patternMinPoints < 4) {
            throw new IllegalArgumentException("pattern min_points must be at least 4");
        }
        // 0 turns the moving-average check off
        if (movingAverageWindow != 0 && movingAverageWindow < 2) {
            throw new IllegalArgumentException("moving_average_window must be 0 or at least 2, got " + movingAverageWindow);
        }
        if (!(movingAverageSigma > 0)) {
            throw new IllegalArgumentException("moving_average_sigma must be positive, got " + movingAverageSigma);
        }
    }

    public boolean isEnabled(DetectorKind kind) {
        return enabledDetectors.contains(kind);
    }

    public static DetectorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.enabled = enabledDetectors.isEmpty() ? EnumSet.noneOf(DetectorKind.class) : EnumSet.copyOf(enabledDetectors);
        builder.minChangePercent = minChangePercent;
        builder.spikeBaselinePoints = spikeBaselinePoints;
        builder.zscoreThreshold = zscoreThreshold;
        builder.iqrMultiplier = iqrMultiplier;
        builder.statisticalBaselinePoints = statisticalBaselinePoints;
        builder.thresholdRule = thresholdRule;
        builder.seasonalTolerance = seasonalTolerance;
        builder.seasonalGranularity = seasonalGranularity;
        builder.baselineMinSamples = baselineMinSamples;
        builder.patternMinPoints = patternMinPoints;
        builder.movingAverageWindow = movingAverageWindow;
        builder.movingAverageSigma = movingAverageSigma;
        return builder;
    }

    public static final class Builder {
        private EnumSet<DetectorKind> enabled = EnumSet.allOf(DetectorKind.class);
        private double minChangePercent = DEFAULT_MIN_CHANGE_PERCENT;
        private int spikeBaselinePoints = 1;
        private double zscoreThreshold = DEFAULT_ZSCORE_THRESHOLD;
        private double iqrMultiplier = DEFAULT_IQR_MULTIPLIER;
        private int statisticalBaselinePoints = 0;
        private ThresholdRule thresholdRule;
        private double seasonalTolerance = DEFAULT_SEASONAL_TOLERANCE;
        private SeasonalGranularity seasonalGranularity = SeasonalGranularity.HOUR_OF_WEEK;
        private int baselineMinSamples = 3;
        private int patternMinPoints = 6;
        private int movingAverageWindow = DEFAULT_MOVING_AVERAGE_WINDOW;
        private double movingAverageSigma = DEFAULT_MOVING_AVERAGE_SIGMA;

        private Builder() {
        }

        public Builder enabled(DetectorKind kind, boolean on) {
            if (on) {
                enabled.add(kind);
            } else {
                enabled.remove(kind);
            }
            return this;
        }

        public Builder onlyEnabled(DetectorKind first, DetectorKind... rest) {
            enabled = EnumSet.of(first, rest);
            return this;
        }

        public Builder minChangePercent(double value) { this.minChangePercent = value; return this; }
        public Builder spikeBaselinePoints(int value) { this.spikeBaselinePoints = value; return this; }
        public Builder zscoreThreshold(double value) { this.zscoreThreshold = value; return this; }
        public Builder iqrMultiplier(double value) { this.iqrMultiplier = value; return this; }
        public Builder statisticalBaselinePoints(int value) { this.statisticalBaselinePoints = value; return this; }
        public Builder thresholdRule(ThresholdRule value) { this.thresholdRule = value; return this; }
        public Builder seasonalTolerance(double value) { this.seasonalTolerance = value; return this; }
        public Builder seasonalGranularity(SeasonalGranularity value) { this.seasonalGranularity = value; return this; }
        public Builder baselineMinSamples(int value) { this.baselineMinSamples = value; return this; }
        public Builder patternMinPoints(int value) { this.patternMinPoints = value; return this; }
        public Builder movingAverageWindow(int value) { this.movingAverageWindow = value; return this; }
        public Builder movingAverageSigma(double value) { this.movingAverageSigma = value; return this; }

        public DetectorConfig build() {
            return new DetectorConfig(enabled, minChangePercent, spikeBaselinePoints, zscoreThreshold, iqrMultiplier,
                    statisticalBaselinePoints, thresholdRule, seasonalTolerance, seasonalGranularity,
                    baselineMinSamples, patternMinPoints, movingAverageWindow, movingAverageSigma);
        }
    }
}
