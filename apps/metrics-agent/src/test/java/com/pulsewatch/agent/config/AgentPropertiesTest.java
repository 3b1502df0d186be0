package com.pulsewatch.agent.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AgentPropertiesTest {

    @Test
    void missingSectionsFallBackToDefaults() {
        AgentProperties props = new AgentProperties(null, null, null, null, null, null, null);

        assertEquals("metrics-agent", props.agent().name());
        assertEquals(Duration.ofSeconds(60), props.agent().pollInterval());
        assertEquals(Duration.ofHours(1), props.agent().lookbackWindow());
        assertEquals(props.agent().pollInterval(), props.agent().dedupWindow());
        assertTrue(props.agent().schedulingEnabled());
        assertFalse(props.agent().shortCircuitOnCriticalThreshold());
        assertEquals("http://localhost:9090", props.prometheus().url());
        assertTrue(props.orchestrator().enabled());
        assertEquals(3, props.orchestrator().maxAttempts());
        assertFalse(props.ai().enabled());
        assertFalse(props.ai().hasApiKey());
        assertTrue(props.metrics().isEmpty());
        assertTrue(props.thresholds().isEmpty());
    }

    @Test
    void dedupWindowFollowsPollInterval() {
        var agent = new AgentProperties.Agent(null, Duration.ofSeconds(15), null, null, null, null, 2, null, null);

        assertEquals(Duration.ofSeconds(15), agent.dedupWindow());
    }

    @Test
    void trailingSlashesAreStripped() {
        assertEquals("http://prom:9090", new AgentProperties.Prometheus("http://prom:9090/", null).url());
        assertEquals("https://llm.example.com/v1",
                new AgentProperties.Ai(true, null, null, "https://llm.example.com/v1/", "k", null, null).endpoint());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> new AgentProperties.Agent(null, Duration.ZERO, null, null, null, null, null, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new AgentProperties.Agent(null, null, null, null, null, null, 0, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new AgentProperties.Orchestrator(true, null, null, 0, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new AgentProperties.MonitoredMetric(" ", null, null, null));
    }

    @Test
    void rejectsDuplicateMetricsAndEmptyThresholds() {
        var cpu = new AgentProperties.MonitoredMetric("cpu", null, null, null);
        assertThrows(IllegalArgumentException.class,
                () -> new AgentProperties(null, null, null, null, null, null, List.of(cpu, cpu)));
        assertThrows(IllegalArgumentException.class,
                () -> new AgentProperties(null, null, null, null, null,
                        Map.of("cpu", new DetectorSettings.Threshold(true, null, null, null)), null));
    }

    @Test
    void onlyEnabledMetricsAreMonitored() {
        var props = new AgentProperties(null, null, null, null, null, null, List.of(
                new AgentProperties.MonitoredMetric("cpu", "avg(rate(cpu[5m]))", null, null),
                new AgentProperties.MonitoredMetric("memory", null, false, null)));

        assertEquals(List.of("cpu"), props.enabledMetrics().stream().map(AgentProperties.MonitoredMetric::name).toList());
        assertEquals("avg(rate(cpu[5m]))", props.enabledMetrics().get(0).toQuery().expression());
    }
}
