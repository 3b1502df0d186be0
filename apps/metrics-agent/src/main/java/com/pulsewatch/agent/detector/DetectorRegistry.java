package com.pulsewatch.agent.detector;

import com.pulsewatch.agent.config.AgentProperties;
import com.pulsewatch.agent.config.DetectorSettings;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps each monitored metric to its enabled detectors and effective parameters. All
 * configs are resolved when the registry is built, so bad values stop startup instead of
 * surfacing mid-cycle.
 */
@Component
public class DetectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(DetectorRegistry.class);

    private final Map<DetectorKind, Detector> detectors = new EnumMap<>(DetectorKind.class);
    private final DetectorSettings globalSettings;
    private final Map<String, DetectorSettings.Threshold> thresholds;
    private final Map<String, DetectorConfig> configs;
    private final DetectorConfig defaultConfig;

    public DetectorRegistry(AgentProperties properties, List<Detector> detectorBeans) {
        for (Detector detector : detectorBeans) {
            Detector previous = detectors.put(detector.kind(), detector);
            if (previous != null) {
                throw new IllegalStateException("More than one detector registered for " + detector.kind());
            }
        }
        this.globalSettings = properties.detectors();
        this.thresholds = properties.thresholds();
        this.defaultConfig = globalSettings.applyTo(DetectorConfig.builder()).build();

        Map<String, DetectorConfig> resolved = new LinkedHashMap<>();
        for (AgentProperties.MonitoredMetric metric : properties.metrics()) {
            resolved.put(metric.name(), resolve(metric.name(), metric.detectors()));
        }
        this.configs = Collections.unmodifiableMap(resolved);
        resolved.forEach((name, config) -> log.info("Metric {} -> detectors {}{}", name,
                config.enabledDetectors().stream().sorted().map(DetectorKind::configKey).toList(),
                config.thresholdRule() != null ? " threshold " + config.thresholdRule() : ""));
    }

    public List<Detector> detectorsFor(String metricName) {
        DetectorConfig config = configFor(metricName);
        List<Detector> enabled = new ArrayList<>();
        for (Map.Entry<DetectorKind, Detector> entry : detectors.entrySet()) {
            if (config.isEnabled(entry.getKey())) {
                enabled.add(entry.getValue());
            }
        }
        return enabled;
    }

    public DetectorConfig configFor(String metricName) {
        DetectorConfig config = configs.get(metricName);
        return config != null ? config : resolve(metricName, DetectorSettings.none());
    }

    public Map<String, DetectorConfig> configs() {
        return configs;
    }

    public List<DetectorDescriptor> describe() {
        List<DetectorDescriptor> descriptors = new ArrayList<>();
        for (DetectorKind kind : detectors.keySet()) {
            descriptors.add(new DetectorDescriptor(kind.detectorName(), kind.configKey(),
                    defaultConfig.isEnabled(kind), parametersOf(kind, defaultConfig)));
        }
        return descriptors;
    }

    public static Map<String, Object> parametersOf(DetectorKind kind, DetectorConfig config) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        switch (kind) {
            case THRESHOLD -> {
                if (config.thresholdRule() != null) {
                    parameters.put("warning", config.thresholdRule().warning());
                    parameters.put("critical", config.thresholdRule().critical());
                    parameters.put("direction", config.thresholdRule().direction());
                }
            }
            case SPIKE -> {
                parameters.put("min_change_percent", config.minChangePercent());
                parameters.put("baseline_points", config.spikeBaselinePoints());
            }
            case STATISTICAL -> {
                parameters.put("zscore_threshold", config.zscoreThreshold());
                parameters.put("iqr_multiplier", config.iqrMultiplier());
                parameters.put("baseline_points", config.statisticalBaselinePoints());
            }
            case PATTERN -> {
                parameters.put("seasonal_tolerance", config.seasonalTolerance());
                parameters.put("granularity", config.seasonalGranularity());
                parameters.put("baseline_min_samples", config.baselineMinSamples());
                parameters.put("min_points", config.patternMinPoints());
                parameters.put("moving_average_window", config.movingAverageWindow());
                parameters.put("moving_average_sigma", config.movingAverageSigma());
            }
        }
        return parameters;
    }

    private DetectorConfig resolve(String metricName, DetectorSettings overrides) {
        DetectorConfig.Builder builder = overrides.applyTo(globalSettings.applyTo(DetectorConfig.builder()));
        try {
            ruleFor(metricName, overrides).ifPresent(builder::thresholdRule);
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid detector configuration for metric " + metricName + ": "
                    + e.getMessage(), e);
        }
    }

    private Optional<DetectorSettings.Threshold> thresholdFor(String metricName) {
        DetectorSettings.Threshold exact = thresholds.get(metricName);
        if (exact != null) {
            return Optional.of(exact);
        }
        // most specific glob wins
        return thresholds.entrySet().stream()
                .filter(entry -> entry.getKey().contains("*") && globMatches(entry.getKey(), metricName))
                .max(Comparator.comparingInt(entry -> entry.getKey().replace("*", "").length()))
                .map(Map.Entry::getValue);
    }

    private Optional<ThresholdRule> ruleFor(String metricName, DetectorSettings overrides) {
        DetectorSettings.Threshold own = overrides.threshold();
        if (own != null && own.hasRule()) {
            return Optional.of(own.toRule());
        }
        return thresholdFor(metricName).map(DetectorSettings.Threshold::toRule);
    }

    static boolean globMatches(String glob, String name) {
        String regex = Arrays.stream(glob.split("\\*", -1))
                .map(Pattern::quote)
                .collect(Collectors.joining(".*"));
        return Pattern.matches(regex, name);
    }
}
