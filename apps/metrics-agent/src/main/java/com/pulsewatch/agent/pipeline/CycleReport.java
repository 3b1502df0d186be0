package com.pulsewatch.agent.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pulsewatch.agent.model.Anomaly;
import com.pulsewatch.agent.model.Severity;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one detection cycle.
 */
public record CycleReport(
        @JsonProperty("cycle_id") String cycleId,
        @JsonProperty("trigger") String trigger,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("finished_at") Instant finishedAt,
        @JsonProperty("metrics_requested") int metricsRequested,
        @JsonProperty("metrics_analyzed") int metricsAnalyzed,
        @JsonProperty("failed_metrics") List<String> failedMetrics,
        @JsonProperty("detector_failures") List<DetectorFailure> detectorFailures,
        @JsonProperty("duplicates_collapsed") int duplicatesCollapsed,
        @JsonProperty("already_forwarded") int alreadyForwarded,
        @JsonProperty("anomalies") List<Anomaly> anomalies,
        @JsonProperty("forwarded") boolean forwarded
) {

    public CycleReport {
        failedMetrics = failedMetrics == null ? List.of() : List.copyOf(failedMetrics);
        detectorFailures = detectorFailures == null ? List.of() : List.copyOf(detectorFailures);
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
    }

    public long durationMillis() {
        return Duration.between(startedAt, finishedAt).toMillis();
    }

    public Map<Severity, Long> countBySeverity() {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0L);
        }
        anomalies.forEach(anomaly -> counts.merge(anomaly.severity(), 1L, Long::sum));
        return counts;
    }
}
