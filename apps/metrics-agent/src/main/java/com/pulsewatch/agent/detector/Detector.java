package com.pulsewatch.agent.detector;

import com.pulsewatch.agent.baseline.BaselineObservation;
import com.pulsewatch.agent.model.Anomaly;
import com.pulsewatch.agent.model.Metric;
import java.util.List;
import java.util.Optional;

/**
 * A detection strategy. Implementations must return an empty list rather than throw for
 * short or empty windows, and must not keep state between calls apart from what they read
 * from the {@link com.pulsewatch.agent.baseline.BaselineCache}.
 */
public interface Detector {

    DetectorKind kind();

    default String name() {
        return kind().detectorName();
    }

    List<Anomaly> detect(Metric metric, DetectorConfig config);

    /**
     * Summary of this window to fold into the rolling baseline once the cycle's detection is
     * over. Only baseline-backed detectors return a value.
     */
    default Optional<BaselineObservation> observe(Metric metric, DetectorConfig config) {
        return Optional.empty();
    }
}
