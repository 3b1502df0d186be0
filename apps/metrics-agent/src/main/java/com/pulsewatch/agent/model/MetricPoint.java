package com.pulsewatch.agent.model;

import java.time.Instant;
import java.util.Objects;

public record MetricPoint(Instant timestamp, double value) {

    public MetricPoint {
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
