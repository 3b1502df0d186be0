package com.pulsewatch.agent.baseline;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BaselineKey(
        @JsonProperty("metric_name") String metricName,
        @JsonProperty("granularity") SeasonalGranularity granularity,
        @JsonProperty("bucket") int bucket
) {
}
