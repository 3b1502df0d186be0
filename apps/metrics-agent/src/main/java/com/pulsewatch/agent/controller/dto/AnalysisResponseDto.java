package com.pulsewatch.agent.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pulsewatch.agent.model.Anomaly;
import com.pulsewatch.agent.pipeline.CycleReport;
import com.pulsewatch.agent.pipeline.DetectorFailure;
import java.time.Instant;
import java.util.List;

public record AnalysisResponseDto(
        @JsonProperty("success") boolean success,
        @JsonProperty("cycle_id") String cycleId,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("anomalies_count") int anomaliesCount,
        @JsonProperty("anomalies") List<Anomaly> anomalies,
        @JsonProperty("duration_ms") long durationMs,
        @JsonProperty("failed_metrics") List<String> failedMetrics,
        @JsonProperty("detector_failures") List<DetectorFailure> detectorFailures,
        @JsonProperty("forwarded") boolean forwarded
) {

    public static AnalysisResponseDto from(CycleReport report) {
        return new AnalysisResponseDto(
                true,
                report.cycleId(),
                report.finishedAt(),
                report.anomalies().size(),
                report.anomalies(),
                report.durationMillis(),
                report.failedMetrics(),
                report.detectorFailures(),
                report.forwarded());
    }
}
