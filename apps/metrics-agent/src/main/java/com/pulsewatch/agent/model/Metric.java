package com.pulsewatch.agent.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable window of points for one named series, as fetched for a single cycle.
 * Points keep the order the backend returned them in, duplicates included.
 */
public record Metric(String name, Map<String, String> labels, List<MetricPoint> points) {

    public static final int MIN_POINTS = 2;

    public Metric {
        Objects.requireNonNull(name, "name");
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        points = points == null ? List.of() : List.copyOf(points);
    }

    public static Metric empty(String name) {
        return new Metric(name, Map.of(), List.of());
    }

    public int size() {
        return points.size();
    }

    public boolean hasSufficientData() {
        return points.size() >= MIN_POINTS;
    }

    public Optional<MetricPoint> latest() {
        return points.isEmpty() ? Optional.empty() : Optional.of(points.get(points.size() - 1));
    }

    public double[] values() {
        return points.stream().mapToDouble(MetricPoint::value).toArray();
    }
}
