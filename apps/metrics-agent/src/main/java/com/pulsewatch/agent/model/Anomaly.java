package com.pulsewatch.agent.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Anomaly emitted by a detector. Value object: enrichment derives copies through
 * {@link #withMetadata(Map)} and keeps the original {@code anomaly_id}.
 */
public record Anomaly(
        @JsonProperty("anomaly_id") String anomalyId,
        @JsonProperty("metric_name") String metricName,
        @JsonProperty("anomaly_type") AnomalyType anomalyType,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("value") double value,
        @JsonProperty("expected_value") double expectedValue,
        @JsonProperty("deviation") Double deviation,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("end_time") Instant endTime,
        @JsonProperty("description") String description,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("labels") Map<String, String> labels,
        @JsonProperty("recommendations") List<String> recommendations,
        @JsonProperty("detector_name") String detectorName
) {

    public Anomaly {
        Objects.requireNonNull(anomalyId, "anomalyId");
        Objects.requireNonNull(metricName, "metricName");
        Objects.requireNonNull(anomalyType, "anomalyType");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(detectorName, "detectorName");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0 and 1, got " + confidence);
        }
        description = description == null ? "" : description;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    /**
     * Percentage deviation of {@code value} from {@code expected}, sign preserved; null when
     * the reference is zero. A null deviation is serialized as {@code "deviation": null}.
     */
    public static Double deviationPercent(double value, double expected) {
        if (expected == 0.0 || Double.isNaN(expected) || Double.isInfinite(expected)) {
            return null;
        }
        return (value - expected) / expected * 100.0;
    }

    public Anomaly withMetadata(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(extra);
        return new Anomaly(anomalyId, metricName, anomalyType, severity, value, expectedValue, deviation,
                confidence, timestamp, startTime, endTime, description, merged, labels, recommendations,
                detectorName);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String anomalyId;
        private String metricName;
        private AnomalyType anomalyType;
        private Severity severity;
        private double value;
        private double expectedValue;
        private Instant timestamp;
        private Instant startTime;
        private Instant endTime;
        private double confidence;
        private String description;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private final Map<String, String> labels = new LinkedHashMap<>();
        private List<String> recommendations;
        private String detectorName;
        private boolean deviationOverridden;
        private Double deviation;

        private Builder() {
        }

        public Builder anomalyId(String anomalyId) { this.anomalyId = anomalyId; return this; }
        public Builder metric(Metric metric) {
            this.metricName = metric.name();
            this.labels.putAll(metric.labels());
            return this;
        }
        public Builder metricName(String metricName) { this.metricName = metricName; return this; }
        public Builder anomalyType(AnomalyType anomalyType) { this.anomalyType = anomalyType; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }
        public Builder value(double value) { this.value = value; return this; }
        public Builder expectedValue(double expectedValue) { this.expectedValue = expectedValue; return this; }
        public Builder deviation(Double deviation) {
            this.deviation = deviation;
            this.deviationOverridden = true;
            return this;
        }
        public Builder confidence(double confidence) { this.confidence = confidence; return this; }
        public Builder timestamp(Instant timestamp) { this.timestamp = timestamp; return this; }
        public Builder startTime(Instant startTime) { this.startTime = startTime; return this; }
        public Builder endTime(Instant endTime) { this.endTime = endTime; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder meta(String key, Object value) { this.metadata.put(key, value); return this; }
        public Builder labels(Map<String, String> labels) { if (labels != null) this.labels.putAll(labels); return this; }
        public Builder recommendations(List<String> recommendations) { this.recommendations = recommendations; return this; }
        public Builder detectorName(String detectorName) { this.detectorName = detectorName; return this; }

        public Anomaly build() {
            Objects.requireNonNull(anomalyType, "anomalyType");
            Double effectiveDeviation = deviationOverridden ? deviation : deviationPercent(value, expectedValue);
            return new Anomaly(
                    anomalyId != null ? anomalyId : UUID.randomUUID().toString(),
                    metricName,
                    anomalyType,
                    severity,
                    value,
                    expectedValue,
                    effectiveDeviation,
                    confidence,
                    timestamp,
                    startTime != null ? startTime : timestamp,
                    endTime,
                    description,
                    metadata,
                    labels,
                    recommendations != null ? recommendations : anomalyType.recommendations(),
                    detectorName);
        }
    }
}
