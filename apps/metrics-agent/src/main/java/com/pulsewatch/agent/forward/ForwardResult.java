package com.pulsewatch.agent.forward;

public enum ForwardResult {
    DELIVERED,
    /** Attempts or deadline exhausted; the batch is gone. */
    DROPPED,
    /** Nothing to send, or forwarding is turned off. */
    SKIPPED
}
