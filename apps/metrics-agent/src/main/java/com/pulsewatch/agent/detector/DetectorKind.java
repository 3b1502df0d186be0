package com.pulsewatch.agent.detector;

/**
 * The closed set of detection strategies. Declaration order is the evaluation order: the
 * cheap stateless threshold check runs before the statistical and pattern passes.
 */
public enum DetectorKind {
    THRESHOLD("threshold", "threshold_detector"),
    SPIKE("spike", "spike_detector"),
    STATISTICAL("statistical", "statistical_detector"),
    PATTERN("pattern", "pattern_detector");

    private final String configKey;
    private final String detectorName;

    DetectorKind(String configKey, String detectorName) {
        this.configKey = configKey;
        this.detectorName = detectorName;
    }

    public String configKey() {
        return configKey;
    }

    public String detectorName() {
        return detectorName;
    }
}
