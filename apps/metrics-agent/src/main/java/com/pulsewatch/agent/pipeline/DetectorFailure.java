package com.pulsewatch.agent.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DetectorFailure(
        @JsonProperty("metric_name") String metricName,
        @JsonProperty("detector_name") String detectorName,
        @JsonProperty("error") String error
) {
}
