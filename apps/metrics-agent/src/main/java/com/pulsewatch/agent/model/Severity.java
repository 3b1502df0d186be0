package com.pulsewatch.agent.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Declaration order is the severity order: LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Shared tiering for score-like magnitudes (z-scores, tolerance multiples).
     */
    public static Severity fromMagnitude(double magnitude) {
        if (magnitude >= 4.0) {
            return CRITICAL;
        }
        if (magnitude >= 3.0) {
            return HIGH;
        }
        if (magnitude >= 2.0) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
