package com.pulsewatch.agent.forward;

import com.pulsewatch.agent.model.Anomaly;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Delivers a cycle's batch downstream. The returned future always completes normally;
 * delivery problems are reported as {@link ForwardResult#DROPPED}.
 */
public interface AnomalyForwarder {

    CompletableFuture<ForwardResult> forward(List<Anomaly> anomalies);
}
