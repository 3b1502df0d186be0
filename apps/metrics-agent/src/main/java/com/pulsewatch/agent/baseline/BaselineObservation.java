package com.pulsewatch.agent.baseline;

/**
 * One cycle's summary of a metric window, to be folded into the rolling baseline after
 * detection has finished.
 */
public record BaselineObservation(BaselineKey key, double windowMean) {
}
