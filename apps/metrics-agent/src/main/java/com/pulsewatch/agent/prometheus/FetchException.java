package com.pulsewatch.agent.prometheus;

public class FetchException extends RuntimeException {

    private final String metricName;

    public FetchException(String metricName, String message) {
        super(message);
        this.metricName = metricName;
    }

    public FetchException(String metricName, String message, Throwable cause) {
        super(message, cause);
        this.metricName = metricName;
    }

    public String metricName() {
        return metricName;
    }
}
