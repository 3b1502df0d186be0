package com.pulsewatch.agent.controller;

import com.pulsewatch.agent.baseline.BaselineCache;
import com.pulsewatch.agent.config.AgentProperties;
import com.pulsewatch.agent.controller.dto.AnalysisResponseDto;
import com.pulsewatch.agent.controller.dto.AnalyzeRequestDto;
import com.pulsewatch.agent.controller.dto.AnomaliesResponseDto;
import com.pulsewatch.agent.controller.dto.BaselineEntryDto;
import com.pulsewatch.agent.controller.dto.MonitoredMetricDto;
import com.pulsewatch.agent.detector.DetectorConfig;
import com.pulsewatch.agent.detector.DetectorDescriptor;
import com.pulsewatch.agent.detector.DetectorKind;
import com.pulsewatch.agent.detector.DetectorRegistry;
import com.pulsewatch.agent.pipeline.CycleReport;
import com.pulsewatch.agent.pipeline.DetectionPipeline;
import jakarta.validation.Valid;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AnalysisController {

    private final DetectionPipeline pipeline;
    private final DetectorRegistry registry;
    private final BaselineCache baselineCache;
    private final AgentProperties properties;

    public AnalysisController(DetectionPipeline pipeline,
                              DetectorRegistry registry,
                              BaselineCache baselineCache,
                              AgentProperties properties) {
        this.pipeline = pipeline;
        this.registry = registry;
        this.baselineCache = baselineCache;
        this.properties = properties;
    }

    @PostMapping("/analyze")
    public ResponseEntity<AnalysisResponseDto> analyze(@Valid @RequestBody(required = false) AnalyzeRequestDto request) {
        List<String> metrics = request != null ? request.metrics() : null;
        boolean forward = request != null && request.forwardFlag();
        CycleReport report = pipeline.runManualCycle(metrics, forward);
        return ResponseEntity.ok(AnalysisResponseDto.from(report));
    }

    @GetMapping("/anomalies")
    public ResponseEntity<AnomaliesResponseDto> anomalies() {
        return ResponseEntity.ok(pipeline.lastReport()
                .map(report -> new AnomaliesResponseDto(report.finishedAt(), report.cycleId(),
                        report.anomalies().size(), report.anomalies()))
                .orElseGet(() -> new AnomaliesResponseDto(null, null, 0, List.of())));
    }

    @GetMapping("/detectors")
    public List<DetectorDescriptor> detectors() {
        return registry.describe();
    }

    @GetMapping("/metrics")
    public List<MonitoredMetricDto> metrics() {
        return properties.metrics().stream()
                .map(metric -> {
                    DetectorConfig config = registry.configFor(metric.name());
                    List<DetectorKind> enabled = config.enabledDetectors().stream().sorted().toList();
                    Map<String, Map<String, Object>> parameters = new LinkedHashMap<>();
                    enabled.forEach(kind -> parameters.put(kind.configKey(), DetectorRegistry.parametersOf(kind, config)));
                    return new MonitoredMetricDto(metric.name(), metric.toQuery().expression(), metric.enabledFlag(),
                            enabled.stream().map(DetectorKind::detectorName).toList(), parameters);
                })
                .toList();
    }

    @GetMapping("/baselines")
    public List<BaselineEntryDto> baselines() {
        return baselineCache.snapshot().entrySet().stream()
                .map(entry -> new BaselineEntryDto(entry.getKey().metricName(), entry.getKey().granularity(),
                        entry.getKey().bucket(), entry.getValue().samples(), entry.getValue().mean(),
                        entry.getValue().stdDev()))
                .sorted(Comparator.comparing(BaselineEntryDto::metricName).thenComparingInt(BaselineEntryDto::bucket))
                .toList();
    }

    @GetMapping("/config")
    public Map<String, Object> config() {
        AgentProperties.Agent agent = properties.agent();
        AgentProperties.Ai ai = properties.ai();
        AgentProperties.Orchestrator orchestrator = properties.orchestrator();

        Map<String, Object> agentSection = new LinkedHashMap<>();
        agentSection.put("name", agent.name());
        agentSection.put("poll_interval", agent.pollInterval().toString());
        agentSection.put("lookback_window", agent.lookbackWindow().toString());
        agentSection.put("step", agent.step().toString());
        agentSection.put("dedup_window", agent.dedupWindow().toString());
        agentSection.put("fetch_timeout", agent.fetchTimeout().toString());
        agentSection.put("parallelism", agent.parallelism());
        agentSection.put("short_circuit_on_critical_threshold", agent.shortCircuitOnCriticalThreshold());
        agentSection.put("scheduling_enabled", agent.schedulingEnabled());

        Map<String, Object> orchestratorSection = new LinkedHashMap<>();
        orchestratorSection.put("enabled", orchestrator.enabled());
        orchestratorSection.put("endpoint", orchestrator.endpoint());
        orchestratorSection.put("timeout", orchestrator.timeout().toString());
        orchestratorSection.put("max_attempts", orchestrator.maxAttempts());
        orchestratorSection.put("initial_backoff", orchestrator.initialBackoff().toString());
        orchestratorSection.put("deadline", orchestrator.deadline().toString());

        Map<String, Object> aiSection = new LinkedHashMap<>();
        aiSection.put("enabled", ai.enabled());
        aiSection.put("endpoint", ai.endpoint());
        aiSection.put("model", ai.model());
        aiSection.put("fallback_model", ai.fallbackModel());
        aiSection.put("api_key", ai.hasApiKey() ? "****" : null);
        aiSection.put("timeout", ai.timeout().toString());
        aiSection.put("filter_false_positives", ai.filterFalsePositives());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("agent", agentSection);
        body.put("prometheus", Map.of("url", properties.prometheus().url(),
                "timeout", properties.prometheus().timeout().toString()));
        body.put("orchestrator", orchestratorSection);
        body.put("ai", aiSection);
        body.put("metrics", properties.metrics().stream().map(AgentProperties.MonitoredMetric::name).toList());
        return body;
    }
}
