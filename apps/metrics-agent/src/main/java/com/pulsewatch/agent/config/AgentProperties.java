package com.pulsewatch.agent.config;

import com.pulsewatch.agent.model.MetricQuery;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "pulsewatch")
public record AgentProperties(
        Agent agent,
        Prometheus prometheus,
        Orchestrator orchestrator,
        Ai ai,
        DetectorSettings detectors,
        Map<String, DetectorSettings.Threshold> thresholds,
        List<MonitoredMetric> metrics
) {

    @ConstructorBinding
    public AgentProperties {
        if (agent == null) {
            agent = new Agent(null, null, null, null, null, null, null, null, null);
        }
        if (prometheus == null) {
            prometheus = new Prometheus(null, null);
        }
        if (orchestrator == null) {
            orchestrator = new Orchestrator(null, null, null, null, null, null);
        }
        if (ai == null) {
            ai = new Ai(false, null, null, null, null, null, null);
        }
        if (detectors == null) {
            detectors = DetectorSettings.none();
        }
        thresholds = thresholds == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(thresholds));
        for (Map.Entry<String, DetectorSettings.Threshold> entry : thresholds.entrySet()) {
            if (entry.getValue() == null || !entry.getValue().hasRule()) {
                throw new IllegalArgumentException("threshold '" + entry.getKey() + "' needs a warning or critical value");
            }
        }
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
        long distinct = metrics.stream().map(MonitoredMetric::name).distinct().count();
        if (distinct != metrics.size()) {
            throw new IllegalArgumentException("metric names must be unique");
        }
    }

    public List<MonitoredMetric> enabledMetrics() {
        return metrics.stream().filter(MonitoredMetric::enabledFlag).toList();
    }

    public record Agent(
            String name,
            Duration pollInterval,
            Duration lookbackWindow,
            Duration step,
            Duration dedupWindow,
            Duration fetchTimeout,
            Integer parallelism,
            Boolean shortCircuitOnCriticalThreshold,
            Boolean schedulingEnabled
    ) {
        public Agent {
            if (name == null || name.isBlank()) {
                name = "metrics-agent";
            }
            pollInterval = requirePositive(pollInterval, Duration.ofSeconds(60), "poll-interval");
            lookbackWindow = requirePositive(lookbackWindow, Duration.ofHours(1), "lookback-window");
            step = requirePositive(step, Duration.ofSeconds(60), "step");
            // dedup window defaults to one cycle
            dedupWindow = requirePositive(dedupWindow, pollInterval, "dedup-window");
            fetchTimeout = requirePositive(fetchTimeout, Duration.ofSeconds(10), "fetch-timeout");
            if (parallelism == null) {
                parallelism = Runtime.getRuntime().availableProcessors();
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be at least 1");
            }
            if (shortCircuitOnCriticalThreshold == null) {
                shortCircuitOnCriticalThreshold = false;
            }
            if (schedulingEnabled == null) {
                schedulingEnabled = true;
            }
        }
    }

    public record Prometheus(String url, Duration timeout) {
        public Prometheus {
            if (url == null || url.isBlank()) {
                url = "http://localhost:9090";
            }
            url = stripTrailingSlash(url);
            timeout = requirePositive(timeout, Duration.ofSeconds(30), "prometheus timeout");
        }
    }

    public record Orchestrator(
            Boolean enabled,
            String endpoint,
            Duration timeout,
            Integer maxAttempts,
            Duration initialBackoff,
            Duration deadline
    ) {
        public Orchestrator {
            if (enabled == null) {
                enabled = true;
            }
            if (endpoint == null || endpoint.isBlank()) {
                endpoint = "http://localhost:8000/api/anomalies";
            }
            timeout = requirePositive(timeout, Duration.ofSeconds(10), "orchestrator timeout");
            if (maxAttempts == null) {
                maxAttempts = 3;
            }
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("orchestrator max-attempts must be at least 1");
            }
            initialBackoff = requirePositive(initialBackoff, Duration.ofSeconds(1), "orchestrator initial-backoff");
            deadline = requirePositive(deadline, Duration.ofSeconds(45), "orchestrator deadline");
        }
    }

    public record Ai(
            Boolean enabled,
            String model,
            String fallbackModel,
            String endpoint,
            String apiKey,
            Duration timeout,
            Boolean filterFalsePositives
    ) {
        public Ai {
            if (enabled == null) {
                enabled = false;
            }
            if (model == null || model.isBlank()) {
                model = "openai/gpt-oss-120b";
            }
            if (fallbackModel == null || fallbackModel.isBlank()) {
                fallbackModel = "llama-3.1-8b-instant";
            }
            if (endpoint == null || endpoint.isBlank()) {
                endpoint = "https://api.groq.com/openai/v1";
            }
            endpoint = stripTrailingSlash(endpoint);
            // apiKey may be blank; the client then falls back to GROQ_API_KEY
            timeout = requirePositive(timeout, Duration.ofSeconds(20), "ai timeout");
            if (filterFalsePositives == null) {
                filterFalsePositives = false;
            }
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    public record MonitoredMetric(String name, String query, Boolean enabled, DetectorSettings detectors) {
        public MonitoredMetric {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("metric name must be provided");
            }
            if (detectors == null) {
                detectors = DetectorSettings.none();
            }
        }

        public boolean enabledFlag() {
            return enabled == null || enabled;
        }

        public MetricQuery toQuery() {
            return new MetricQuery(name, query);
        }
    }

    private static Duration requirePositive(Duration value, Duration fallback, String field) {
        if (value == null) {
            return fallback;
        }
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(field + " must be positive, got " + value);
        }
        return value;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
