package com.pulsewatch.agent.detector;

public record ThresholdRule(Double warning, Double critical, ThresholdDirection direction) {

    public ThresholdRule {
        if (warning == null && critical == null) {
            throw new IllegalArgumentException("threshold rule needs a warning or critical value");
        }
        if (direction == null) {
            direction = ThresholdDirection.UPPER;
        }
        if (warning != null && critical != null) {
            if (direction == ThresholdDirection.UPPER && warning > critical) {
                throw new IllegalArgumentException(
                        "warning (" + warning + ") must not exceed critical (" + critical + ") for an upper bound");
            }
            if (direction == ThresholdDirection.LOWER && warning < critical) {
                throw new IllegalArgumentException(
                        "warning (" + warning + ") must not be below critical (" + critical + ") for a lower bound");
            }
        }
    }

    public static ThresholdRule upper(Double warning, Double critical) {
        return new ThresholdRule(warning, critical, ThresholdDirection.UPPER);
    }

    public static ThresholdRule lower(Double warning, Double critical) {
        return new ThresholdRule(warning, critical, ThresholdDirection.LOWER);
    }
}
