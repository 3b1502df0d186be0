package com.pulsewatch.agent.ai;

import com.pulsewatch.agent.model.Anomaly;
import java.time.Duration;
import java.util.List;

/**
 * Optional post-processing of a cycle's anomalies. Implementations return the input list
 * unchanged when they time out or fail.
 */
public interface AnomalyEnricher {

    List<Anomaly> enrich(List<Anomaly> anomalies, Duration timeout);
}
