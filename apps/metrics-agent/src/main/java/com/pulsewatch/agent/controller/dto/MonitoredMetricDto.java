package com.pulsewatch.agent.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public record MonitoredMetricDto(
        @JsonProperty("name") String name,
        @JsonProperty("query") String query,
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("detectors") List<String> detectors,
        @JsonProperty("parameters") Map<String, Map<String, Object>> parameters
) {
}
