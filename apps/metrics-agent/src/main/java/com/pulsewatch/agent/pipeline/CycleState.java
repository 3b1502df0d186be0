package com.pulsewatch.agent.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum CycleState {
    IDLE,
    FETCHING,
    DETECTING,
    AGGREGATING,
    FORWARDING;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
