package com.pulsewatch.agent.forward;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pulsewatch.agent.model.Anomaly;
import java.util.List;

public record ForwardPayload(
        @JsonProperty("agent") String agent,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("anomalies") List<Anomaly> anomalies
) {
}
