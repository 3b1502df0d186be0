package com.pulsewatch.agent.detector;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public record DetectorDescriptor(
        @JsonProperty("name") String name,
        @JsonProperty("config_key") String configKey,
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("parameters") Map<String, Object> parameters
) {
}
