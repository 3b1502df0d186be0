package com.pulsewatch.agent.pipeline;

import com.pulsewatch.agent.ai.AnomalyEnricher;
import com.pulsewatch.agent.baseline.BaselineCache;
import com.pulsewatch.agent.baseline.BaselineObservation;
import com.pulsewatch.agent.config.AgentProperties;
import com.pulsewatch.agent.detector.Detector;
import com.pulsewatch.agent.detector.DetectorConfig;
import com.pulsewatch.agent.detector.DetectorKind;
import com.pulsewatch.agent.detector.DetectorRegistry;
import com.pulsewatch.agent.forward.AnomalyForwarder;
import com.pulsewatch.agent.model.Anomaly;
import com.pulsewatch.agent.model.Metric;
import com.pulsewatch.agent.model.MetricQuery;
import com.pulsewatch.agent.model.Severity;
import com.pulsewatch.agent.prometheus.MetricFetcher;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs detection cycles: fetch every metric window, run the enabled detectors, merge and
 * deduplicate the results, then hand the batch to the forwarder. One cycle at a time.
 */
@Service
public class DetectionPipeline {

    private static final Logger log = LoggerFactory.getLogger(DetectionPipeline.class);
    private static final int MAX_FETCH_THREADS = 8;

    static final Comparator<Anomaly> OUTPUT_ORDER = Comparator.comparing(Anomaly::metricName)
            .thenComparing(Anomaly::anomalyType)
            .thenComparing(Anomaly::timestamp);

    private final AgentProperties properties;
    private final MetricFetcher fetcher;
    private final DetectorRegistry registry;
    private final BaselineCache baselineCache;
    private final AnomalyDeduplicator deduplicator;
    private final AnomalyEnricher enricher;
    private final AnomalyForwarder forwarder;
    private final Clock clock;
    private final ExecutorService fetchPool;
    private final ExecutorService detectionPool;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<CycleState> state = new AtomicReference<>(CycleState.IDLE);
    private final AtomicReference<CycleReport> lastReport = new AtomicReference<>();

    @Autowired
    public DetectionPipeline(AgentProperties properties,
                             MetricFetcher fetcher,
                             DetectorRegistry registry,
                             BaselineCache baselineCache,
                             AnomalyDeduplicator deduplicator,
                             AnomalyEnricher enricher,
                             AnomalyForwarder forwarder) {
        this(properties, fetcher, registry, baselineCache, deduplicator, enricher, forwarder, Clock.systemUTC());
    }

    DetectionPipeline(AgentProperties properties,
                      MetricFetcher fetcher,
                      DetectorRegistry registry,
                      BaselineCache baselineCache,
                      AnomalyDeduplicator deduplicator,
                      AnomalyEnricher enricher,
                      AnomalyForwarder forwarder,
                      Clock clock) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.registry = registry;
        this.baselineCache = baselineCache;
        this.deduplicator = deduplicator;
        this.enricher = enricher;
        this.forwarder = forwarder;
        this.clock = clock;
        int fetchThreads = Math.max(1, Math.min(properties.metrics().size(), MAX_FETCH_THREADS));
        this.fetchPool = Executors.newFixedThreadPool(fetchThreads, namedThreads("metric-fetch"));
        this.detectionPool = Executors.newFixedThreadPool(properties.agent().parallelism(), namedThreads("detector"));
    }

    public CycleState state() {
        return state.get();
    }

    public Optional<CycleReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    /**
     * Scheduled entry point. Skips the tick when a cycle is still running.
     */
    public Optional<CycleReport> runScheduledCycle() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Skipping scheduled cycle: previous cycle still {}", state.get().wireValue());
            return Optional.empty();
        }
        try {
            return Optional.of(execute(queriesFor(null), true, "scheduled"));
        } finally {
            running.set(false);
        }
    }

    /**
     * Runs a cycle on request, optionally restricted to some of the configured metrics.
     *
     * @throws CycleInProgressException when another cycle is running
     * @throws IllegalArgumentException when a requested metric is not configured
     */
    public CycleReport runManualCycle(Collection<String> metricNames, boolean forward) {
        List<MetricQuery> queries = queriesFor(metricNames);
        if (!running.compareAndSet(false, true)) {
            throw new CycleInProgressException(state.get());
        }
        try {
            return execute(queries, forward, "manual");
        } finally {
            running.set(false);
        }
    }

    private List<MetricQuery> queriesFor(Collection<String> metricNames) {
        List<AgentProperties.MonitoredMetric> enabled = properties.enabledMetrics();
        if (metricNames == null || metricNames.isEmpty()) {
            return enabled.stream().map(AgentProperties.MonitoredMetric::toQuery).toList();
        }
        Map<String, AgentProperties.MonitoredMetric> byName = enabled.stream()
                .collect(Collectors.toMap(AgentProperties.MonitoredMetric::name, m -> m, (a, b) -> a, LinkedHashMap::new));
        List<MetricQuery> queries = new ArrayList<>();
        for (String name : Set.copyOf(metricNames)) {
            AgentProperties.MonitoredMetric metric = byName.get(name);
            if (metric == null) {
                throw new IllegalArgumentException("Unknown or disabled metric: " + name);
            }
            queries.add(metric.toQuery());
        }
        queries.sort(Comparator.comparing(MetricQuery::name));
        return queries;
    }

    private CycleReport execute(List<MetricQuery> queries, boolean forward, String trigger) {
        String cycleId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        Duration dedupWindow = properties.agent().dedupWindow();
        log.info("Cycle {} ({}) started for {} metrics", cycleId, trigger, queries.size());
        try {
            state.set(CycleState.FETCHING);
            List<String> failedMetrics = new ArrayList<>();
            List<Metric> metrics = fetchAll(queries, startedAt, failedMetrics);

            state.set(CycleState.DETECTING);
            DetectionOutcome outcome = detectAll(metrics);
            baselineCache.commit(outcome.observations());

            state.set(CycleState.AGGREGATING);
            List<Anomaly> sorted = outcome.anomalies().stream().sorted(OUTPUT_ORDER).toList();
            AnomalyDeduplicator.Collapsed collapsed = deduplicator.collapse(sorted, dedupWindow);
            List<Anomaly> batch = collapsed.kept();
            int alreadyForwarded = 0;
            if (forward) {
                List<Anomaly> fresh = deduplicator.suppressRecentlyForwarded(batch, startedAt, dedupWindow);
                alreadyForwarded = batch.size() - fresh.size();
                batch = fresh;
            }
            batch = enricher.enrich(batch, properties.ai().timeout());

            state.set(CycleState.FORWARDING);
            boolean forwarded = false;
            if (forward && !batch.isEmpty()) {
                deduplicator.markForwarded(batch, startedAt);
                int size = batch.size();
                forwarder.forward(batch).whenComplete((result, error) ->
                        log.debug("Cycle {} forwarding of {} anomalies finished: {}", cycleId, size, result));
                forwarded = true;
            }

            CycleReport report = new CycleReport(cycleId, trigger, startedAt, clock.instant(), queries.size(),
                    metrics.size(), failedMetrics, outcome.failures(), collapsed.dropped(), alreadyForwarded,
                    batch, forwarded);
            lastReport.set(report);
            logSummary(report);
            return report;
        } finally {
            state.set(CycleState.IDLE);
        }
    }

    private List<Metric> fetchAll(List<MetricQuery> queries, Instant end, List<String> failedMetrics) {
        Instant start = end.minus(properties.agent().lookbackWindow());
        Duration step = properties.agent().step();
        long timeoutMs = properties.agent().fetchTimeout().toMillis();
        Map<MetricQuery, CompletableFuture<Metric>> pending = new LinkedHashMap<>();
        for (MetricQuery query : queries) {
            pending.put(query, CompletableFuture
                    .supplyAsync(() -> fetcher.fetch(query, start, end, step), fetchPool)
                    .orTimeout(timeoutMs, TimeUnit.MILLISECONDS));
        }
        List<Metric> metrics = new ArrayList<>();
        pending.forEach((query, future) -> {
            try {
                Metric metric = future.join();
                if (!metric.hasSufficientData()) {
                    log.debug("Metric {} returned {} points; detectors will skip it", query.name(), metric.size());
                }
                metrics.add(metric);
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof TimeoutException) {
                    log.warn("Fetch for {} timed out after {}; skipping it this cycle", query.name(),
                            properties.agent().fetchTimeout());
                } else {
                    log.warn("Fetch for {} failed; skipping it this cycle: {}", query.name(), cause.getMessage());
                }
                failedMetrics.add(query.name());
            }
        });
        return metrics;
    }

    /**
     * Runs every enabled detector over every metric. Detector failures are isolated per
     * (metric, detector) pair. The baseline cache is not touched here.
     */
    DetectionOutcome detectAll(List<Metric> metrics) {
        List<CompletableFuture<DetectionOutcome>> tasks = metrics.stream()
                .map(metric -> CompletableFuture.supplyAsync(() -> detectMetric(metric), detectionPool))
                .toList();
        List<Anomaly> anomalies = new ArrayList<>();
        List<DetectorFailure> failures = new ArrayList<>();
        List<BaselineObservation> observations = new ArrayList<>();
        for (CompletableFuture<DetectionOutcome> task : tasks) {
            DetectionOutcome outcome = task.join();
            anomalies.addAll(outcome.anomalies());
            failures.addAll(outcome.failures());
            observations.addAll(outcome.observations());
        }
        return new DetectionOutcome(anomalies, failures, observations);
    }

    private DetectionOutcome detectMetric(Metric metric) {
        DetectorConfig config = registry.configFor(metric.name());
        List<Detector> detectors = registry.detectorsFor(metric.name());
        List<Anomaly> anomalies = new ArrayList<>();
        List<DetectorFailure> failures = new ArrayList<>();
        List<BaselineObservation> observations = new ArrayList<>();
        boolean shortCircuit = properties.agent().shortCircuitOnCriticalThreshold();

        for (Detector detector : detectors) {
            try {
                List<Anomaly> found = detector.detect(metric, config);
                log.debug("{} found {} anomalies on {}", detector.name(), found.size(), metric.name());
                anomalies.addAll(found);
                if (shortCircuit && detector.kind() == DetectorKind.THRESHOLD
                        && found.stream().anyMatch(a -> a.severity() == Severity.CRITICAL)) {
                    log.info("Critical threshold breach on {}; skipping remaining detectors", metric.name());
                    break;
                }
            } catch (Exception | StackOverflowError | LinkageError | AssertionError e) {
                log.error("Detector {} failed on metric {}", detector.name(), metric.name(), e);
                failures.add(new DetectorFailure(metric.name(), detector.name(), String.valueOf(e.getMessage())));
            }
        }
        for (Detector detector : detectors) {
            try {
                detector.observe(metric, config).ifPresent(observations::add);
            } catch (Exception | StackOverflowError | LinkageError | AssertionError e) {
                log.error("Detector {} could not summarise metric {} for the baseline", detector.name(), metric.name(), e);
            }
        }
        return new DetectionOutcome(anomalies, failures, observations);
    }

    private void logSummary(CycleReport report) {
        for (Anomaly anomaly : report.anomalies()) {
            if (anomaly.severity() == Severity.CRITICAL) {
                log.warn("CRITICAL {} on {}: {}", anomaly.anomalyType().wireValue(), anomaly.metricName(),
                        anomaly.description());
            }
        }
        String bySeverity = report.countBySeverity().entrySet().stream()
                .map(entry -> entry.getKey().wireValue() + "=" + entry.getValue())
                .collect(Collectors.joining(", "));
        log.info("Cycle {} finished in {} ms: {}/{} metrics analysed, {} anomalies [{}], {} failed fetches, "
                        + "{} detector failures, {} collapsed, {} already forwarded",
                report.cycleId(), report.durationMillis(), report.metricsAnalyzed(), report.metricsRequested(),
                report.anomalies().size(), bySeverity, report.failedMetrics().size(),
                report.detectorFailures().size(), report.duplicatesCollapsed(), report.alreadyForwarded());
    }

    @PreDestroy
    void shutdown() {
        fetchPool.shutdownNow();
        detectionPool.shutdownNow();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    record DetectionOutcome(
            List<Anomaly> anomalies,
            List<DetectorFailure> failures,
            List<BaselineObservation> observations) {
    }
}
