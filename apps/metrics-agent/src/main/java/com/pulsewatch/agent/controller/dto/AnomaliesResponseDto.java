package com.pulsewatch.agent.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pulsewatch.agent.model.Anomaly;
import java.time.Instant;
import java.util.List;

public record AnomaliesResponseDto(
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("cycle_id") String cycleId,
        @JsonProperty("count") int count,
        @JsonProperty("anomalies") List<Anomaly> anomalies
) {
}
