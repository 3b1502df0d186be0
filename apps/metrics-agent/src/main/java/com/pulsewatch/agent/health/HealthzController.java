package com.pulsewatch.agent.health;

import com.pulsewatch.agent.config.AgentProperties;
import com.pulsewatch.agent.pipeline.DetectionPipeline;
import com.pulsewatch.agent.prometheus.PrometheusClient;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness plus a quick view of the pipeline and its Prometheus backend.
 */
@RestController
public class HealthzController {

    private final DetectionPipeline pipeline;
    private final PrometheusClient prometheusClient;
    private final AgentProperties properties;

    public HealthzController(DetectionPipeline pipeline, PrometheusClient prometheusClient, AgentProperties properties) {
        this.pipeline = pipeline;
        this.prometheusClient = prometheusClient;
        this.properties = properties;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> healthz() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("agent_name", properties.agent().name());
        body.put("pipeline_state", pipeline.state());
        body.put("prometheus_url", prometheusClient.baseUrl());
        body.put("prometheus_reachable", prometheusClient.isReachable());
        return body;
    }
}
