package com.pulsewatch.agent.detector;

public enum ThresholdDirection {
    /** Breach when the value rises to or above the threshold. */
    UPPER,
    /** Breach when the value falls to or below the threshold. */
    LOWER;

    boolean breaches(double value, double threshold) {
        return this == UPPER ? value >= threshold : value <= threshold;
    }
}
