package com.pulsewatch.agent.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds metric windows sampled once a minute from a fixed Monday-morning start.
 */
public final class MetricFixtures {

    public static final Instant START = Instant.parse("2024-03-04T10:00:00Z");
    public static final Duration STEP = Duration.ofMinutes(1);

    private MetricFixtures() {
    }

    public static Metric series(String name, double... values) {
        return series(name, START, values);
    }

    public static Metric series(String name, Instant start, double... values) {
        List<MetricPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(new MetricPoint(start.plus(STEP.multipliedBy(i)), values[i]));
        }
        return new Metric(name, Map.of("job", "api"), points);
    }

    public static Instant at(int index) {
        return START.plus(STEP.multipliedBy(index));
    }
}
