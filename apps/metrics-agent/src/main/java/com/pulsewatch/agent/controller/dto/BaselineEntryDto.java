package com.pulsewatch.agent.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pulsewatch.agent.baseline.SeasonalGranularity;

public record BaselineEntryDto(
        @JsonProperty("metric_name") String metricName,
        @JsonProperty("granularity") SeasonalGranularity granularity,
        @JsonProperty("bucket") int bucket,
        @JsonProperty("samples") long samples,
        @JsonProperty("mean") double mean,
        @JsonProperty("std_dev") double stdDev
) {
}
