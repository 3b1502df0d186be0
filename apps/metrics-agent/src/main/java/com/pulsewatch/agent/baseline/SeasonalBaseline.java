package com.pulsewatch.agent.baseline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Running mean and variance (Welford) of the per-cycle window means seen for one bucket.
 */
public record SeasonalBaseline(
        @JsonProperty("samples") long samples,
        @JsonProperty("mean") double mean,
        @JsonIgnore double m2
) {

    public static SeasonalBaseline first(double value) {
        return new SeasonalBaseline(1, value, 0d);
    }

    public SeasonalBaseline plus(double value) {
        long n = samples + 1;
        double delta = value - mean;
        double nextMean = mean + delta / n;
        return new SeasonalBaseline(n, nextMean, m2 + delta * (value - nextMean));
    }

    @JsonProperty("std_dev")
    public double stdDev() {
        return samples < 2 ? 0d : Math.sqrt(m2 / (samples - 1));
    }
}
