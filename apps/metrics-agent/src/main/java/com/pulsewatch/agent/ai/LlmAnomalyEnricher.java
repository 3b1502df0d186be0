package com.pulsewatch.agent.ai;

import com.pulsewatch.agent.config.AgentProperties;
import com.pulsewatch.agent.model.Anomaly;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Asks the LLM to review each anomaly and attaches its verdict to the metadata. The stage is
 * bounded by a timeout and never changes the batch when anything goes wrong. A batch that
 * runs past its timeout is interrupted and stops calling the LLM; each batch gets its own
 * worker so the next one never queues behind it.
 */
@Service
public class LlmAnomalyEnricher implements AnomalyEnricher {

    private static final Logger log = LoggerFactory.getLogger(LlmAnomalyEnricher.class);
    static final String FALSE_POSITIVE_VERDICT = "VERDICT: FALSE_POSITIVE";

    private final LlmClient llmClient;
    private final boolean enabled;
    private final boolean filterFalsePositives;
    private final AtomicInteger threadCount = new AtomicInteger();
    private final ExecutorService executor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "llm-enricher-" + threadCount.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    public LlmAnomalyEnricher(LlmClient llmClient, AgentProperties properties) {
        this.llmClient = llmClient;
        this.enabled = properties.ai().enabled();
        this.filterFalsePositives = properties.ai().filterFalsePositives();
    }

    public boolean isActive() {
        return enabled && llmClient.hasCredentials();
    }

    @Override
    public List<Anomaly> enrich(List<Anomaly> anomalies, Duration timeout) {
        if (anomalies.isEmpty() || !enabled) {
            return anomalies;
        }
        if (!llmClient.hasCredentials()) {
            log.debug("LLM enrichment enabled but no API key configured; skipping");
            return anomalies;
        }
        Future<List<Anomaly>> task = executor.submit(() -> review(anomalies));
        try {
            return task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("LLM enrichment timed out after {}; forwarding {} anomalies unenriched", timeout, anomalies.size());
        } catch (ExecutionException e) {
            log.warn("LLM enrichment failed; forwarding {} anomalies unenriched", anomalies.size(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("LLM enrichment interrupted; forwarding {} anomalies unenriched", anomalies.size());
        }
        return anomalies;
    }

    private List<Anomaly> review(List<Anomaly> anomalies) {
        log.info("Reviewing {} anomalies with LLM model {}", anomalies.size(), llmClient.model());
        List<Anomaly> kept = new ArrayList<>(anomalies.size());
        for (Anomaly anomaly : anomalies) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("LLM review abandoned after {} of {} anomalies", kept.size(), anomalies.size());
                return anomalies;
            }
            Optional<LlmClient.Completion> completion = llmClient.complete(List.of(
                    new LlmClient.Message("system", "You are an expert in service metrics and monitoring."),
                    new LlmClient.Message("user", buildPrompt(anomaly))));
            if (completion.isEmpty()) {
                kept.add(anomaly.withMetadata(Map.of("llm_validated", false)));
                continue;
            }
            String analysis = completion.get().text();
            if (filterFalsePositives && isFalsePositive(analysis)) {
                log.warn("LLM marked anomaly {} on {} ({}) as a false positive; dropping it",
                        anomaly.anomalyId(), anomaly.metricName(), anomaly.anomalyType().wireValue());
                continue;
            }
            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("llm_analysis", analysis);
            extra.put("llm_model", completion.get().model());
            extra.put("llm_validated", true);
            kept.add(anomaly.withMetadata(extra));
        }
        log.info("LLM review complete: {} of {} anomalies kept", kept.size(), anomalies.size());
        return kept;
    }

    static boolean isFalsePositive(String analysis) {
        return analysis != null && analysis.toUpperCase(Locale.ROOT).contains(FALSE_POSITIVE_VERDICT);
    }

    static String buildPrompt(Anomaly anomaly) {
        return """
                Review this anomaly reported by a metrics monitoring agent.

                ANOMALY:
                - Metric: %s
                - Type: %s
                - Observed value: %s
                - Expected value: %s
                - Severity: %s
                - Detector confidence: %s
                - Description: %s

                Start your answer with "VERDICT: REAL" or "VERDICT: FALSE_POSITIVE", then cover:
                1. Why you think so.
                2. The likely impact on the service.
                3. What to investigate first.
                Be precise and concise.
                """.formatted(
                anomaly.metricName(),
                anomaly.anomalyType().wireValue(),
                anomaly.value(),
                anomaly.expectedValue(),
                anomaly.severity().wireValue(),
                anomaly.confidence(),
                anomaly.description());
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}
