package com.pulsewatch.agent.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;

public enum AnomalyType {
    SPIKE(List.of(
            "Check recent deployments or configuration changes",
            "Correlate with traffic sources and upstream callers",
            "Verify autoscaling reacted to the increased load")),
    DROP(List.of(
            "Check service availability and health checks",
            "Verify upstream dependencies and network connectivity",
            "Confirm the metric exporter is still reporting")),
    STATISTICAL_OUTLIER(List.of(
            "Compare with the same period on previous days",
            "Inspect related metrics for correlated deviations",
            "Review logs around the anomaly timestamp")),
    THRESHOLD_BREACH(List.of(
            "Check capacity and resource limits",
            "Scale the affected component if the breach persists",
            "Review whether the configured thresholds are still appropriate")),
    PATTERN_ANOMALY(List.of(
            "Compare with the seasonal baseline for this time period",
            "Look for gradual degradation such as leaks or queue build-up",
            "Check scheduled jobs and batch workloads"));

    private final List<String> recommendations;

    AnomalyType(List<String> recommendations) {
        this.recommendations = recommendations;
    }

    public List<String> recommendations() {
        return recommendations;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AnomalyType fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
