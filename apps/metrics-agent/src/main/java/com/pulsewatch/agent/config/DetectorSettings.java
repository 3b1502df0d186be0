package com.pulsewatch.agent.config;

import com.pulsewatch.agent.baseline.SeasonalGranularity;
import com.pulsewatch.agent.detector.DetectorConfig;
import com.pulsewatch.agent.detector.DetectorKind;
import com.pulsewatch.agent.detector.ThresholdDirection;
import com.pulsewatch.agent.detector.ThresholdRule;

/**
 * Detector parameters as written in configuration. Every field is optional: unset values
 * inherit from the layer below (built-in defaults, then {@code pulsewatch.detectors}, then
 * the metric's own {@code detectors} block).
 */
public record DetectorSettings(
        Threshold threshold,
        Spike spike,
        Statistical statistical,
        Pattern pattern
) {

    public static DetectorSettings none() {
        return new DetectorSettings(null, null, null, null);
    }

    /**
     * Layers the values set here over {@code builder}. Threshold warning/critical values are
     * resolved separately by the registry since they also come from the global rule map.
     */
    public DetectorConfig.Builder applyTo(DetectorConfig.Builder builder) {
        if (threshold != null && threshold.enabled() != null) {
            builder.enabled(DetectorKind.THRESHOLD, threshold.enabled());
        }
        if (spike != null) {
            if (spike.enabled() != null) builder.enabled(DetectorKind.SPIKE, spike.enabled());
            if (spike.minChangePercent() != null) builder.minChangePercent(spike.minChangePercent());
            if (spike.baselinePoints() != null) builder.spikeBaselinePoints(spike.baselinePoints());
        }
        if (statistical != null) {
            if (statistical.enabled() != null) builder.enabled(DetectorKind.STATISTICAL, statistical.enabled());
            if (statistical.zscoreThreshold() != null) builder.zscoreThreshold(statistical.zscoreThreshold());
            if (statistical.iqrMultiplier() != null) builder.iqrMultiplier(statistical.iqrMultiplier());
            if (statistical.baselinePoints() != null) builder.statisticalBaselinePoints(statistical.baselinePoints());
        }
        if (pattern != null) {
            if (pattern.enabled() != null) builder.enabled(DetectorKind.PATTERN, pattern.enabled());
            if (pattern.seasonalTolerance() != null) builder.seasonalTolerance(pattern.seasonalTolerance());
            if (pattern.granularity() != null) builder.seasonalGranularity(pattern.granularity());
            if (pattern.baselineMinSamples() != null) builder.baselineMinSamples(pattern.baselineMinSamples());
            if (pattern.minPoints() != null) builder.patternMinPoints(pattern.minPoints());
            if (pattern.movingAverageWindow() != null) builder.movingAverageWindow(pattern.movingAverageWindow());
            if (pattern.movingAverageSigma() != null) builder.movingAverageSigma(pattern.movingAverageSigma());
        }
        return builder;
    }

    public record Threshold(Boolean enabled, Double warning, Double critical, ThresholdDirection direction) {

        public boolean hasRule() {
            return warning != null || critical != null;
        }

        public ThresholdRule toRule() {
            return hasRule() ? new ThresholdRule(warning, critical, direction) : null;
        }
    }

    public record Spike(Boolean enabled, Double minChangePercent, Integer baselinePoints) {
    }

    public record Statistical(Boolean enabled, Double zscoreThreshold, Double iqrMultiplier, Integer baselinePoints) {
    }

    public record Pattern(
            Boolean enabled,
            Double seasonalTolerance,
            SeasonalGranularity granularity,
            Integer baselineMinSamples,
            Integer minPoints,
            Integer movingAverageWindow,
            Double movingAverageSigma
    ) {
    }
}
