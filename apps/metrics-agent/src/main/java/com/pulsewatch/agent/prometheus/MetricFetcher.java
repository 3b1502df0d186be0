package com.pulsewatch.agent.prometheus;

import com.pulsewatch.agent.model.Metric;
import com.pulsewatch.agent.model.MetricQuery;
import java.time.Duration;
import java.time.Instant;

@FunctionalInterface
public interface MetricFetcher {

    /**
     * Loads the window {@code [start, end]} for one query. An empty result is returned as a
     * metric without points.
     *
     * @throws FetchException when the backend cannot be reached or answers with an error
     */
    Metric fetch(MetricQuery query, Instant start, Instant end, Duration step);
}
