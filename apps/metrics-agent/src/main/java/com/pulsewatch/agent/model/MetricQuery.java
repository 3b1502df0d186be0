package com.pulsewatch.agent.model;

/**
 * A monitored metric name plus the PromQL expression that produces its series.
 */
public record MetricQuery(String name, String expression) {

    public MetricQuery {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("metric name must be provided");
        }
        if (expression == null || expression.isBlank()) {
            expression = name;
        }
    }

    public static MetricQuery of(String name) {
        return new MetricQuery(name, name);
    }
}
