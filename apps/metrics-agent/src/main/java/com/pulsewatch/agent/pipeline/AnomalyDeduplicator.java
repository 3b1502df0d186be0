package com.pulsewatch.agent.pipeline;

import com.pulsewatch.agent.model.Anomaly;
import com.pulsewatch.agent.model.AnomalyType;
import com.pulsewatch.agent.model.Severity;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Collapses anomalies sharing a metric and type within the dedup window, and remembers
 * which keys were forwarded so a condition that persists across cycles is sent at most once
 * per window, unless it escalates to a higher severity.
 */
@Component
public class AnomalyDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDeduplicator.class);

    /** Highest severity first, then most recent. */
    static final Comparator<Anomaly> PREFERENCE = Comparator.comparing(Anomaly::severity)
            .thenComparing(Anomaly::timestamp)
            .reversed();

    private final Map<Key, Forwarded> lastForwarded = new ConcurrentHashMap<>();

    record Key(String metricName, AnomalyType anomalyType) {
        static Key of(Anomaly anomaly) {
            return new Key(anomaly.metricName(), anomaly.anomalyType());
        }
    }

    record Forwarded(Instant at, Severity severity) {}

    public record Collapsed(List<Anomaly> kept, int dropped) {}

    /**
     * Groups by (metric_name, anomaly_type) and, inside each group, merges anomalies whose
     * timestamps fall within {@code window} of the first one of their run. Output order
     * follows the input order of the retained anomalies.
     */
    public Collapsed collapse(List<Anomaly> anomalies, Duration window) {
        Map<Key, List<Anomaly>> groups = new LinkedHashMap<>();
        for (Anomaly anomaly : anomalies) {
            groups.computeIfAbsent(Key.of(anomaly), key -> new ArrayList<>()).add(anomaly);
        }
        Set<Anomaly> retained = Collections.newSetFromMap(new IdentityHashMap<>());
        int dropped = 0;
        for (List<Anomaly> group : groups.values()) {
            group.sort(Comparator.comparing(Anomaly::timestamp));
            List<Anomaly> run = new ArrayList<>();
            for (Anomaly anomaly : group) {
                if (!run.isEmpty() && Duration.between(run.get(0).timestamp(), anomaly.timestamp()).compareTo(window) > 0) {
                    dropped += keepBest(run, retained);
                    run = new ArrayList<>();
                }
                run.add(anomaly);
            }
            dropped += keepBest(run, retained);
        }
        List<Anomaly> kept = anomalies.stream().filter(retained::contains).toList();
        return new Collapsed(kept, dropped);
    }

    private int keepBest(List<Anomaly> run, Set<Anomaly> retained) {
        if (run.isEmpty()) {
            return 0;
        }
        Anomaly best = run.stream().sorted(PREFERENCE).findFirst().orElseThrow();
        retained.add(best);
        for (Anomaly other : run) {
            if (other != best) {
                log.info("Collapsed duplicate {} {} ({}, {}) into {} ({})", other.metricName(),
                        other.anomalyType().wireValue(), other.anomalyId(), other.severity().wireValue(),
                        best.anomalyId(), best.severity().wireValue());
            }
        }
        return run.size() - 1;
    }

    /**
     * Removes anomalies whose key was forwarded less than {@code window} before {@code now}
     * at the same or a higher severity.
     */
    public List<Anomaly> suppressRecentlyForwarded(List<Anomaly> anomalies, Instant now, Duration window) {
        lastForwarded.entrySet().removeIf(entry -> !entry.getValue().at().isAfter(now.minus(window)));
        List<Anomaly> fresh = new ArrayList<>(anomalies.size());
        for (Anomaly anomaly : anomalies) {
            Forwarded previous = lastForwarded.get(Key.of(anomaly));
            if (previous == null) {
                fresh.add(anomaly);
            } else if (anomaly.severity().compareTo(previous.severity()) > 0) {
                log.info("Forwarding {} {} ({}) again: escalated from {} to {}", anomaly.metricName(),
                        anomaly.anomalyType().wireValue(), anomaly.anomalyId(), previous.severity().wireValue(),
                        anomaly.severity().wireValue());
                fresh.add(anomaly);
            } else {
                log.info("Suppressed {} {} ({}): already forwarded as {} at {} within the dedup window",
                        anomaly.metricName(), anomaly.anomalyType().wireValue(), anomaly.anomalyId(),
                        previous.severity().wireValue(), previous.at());
            }
        }
        return fresh;
    }

    public void markForwarded(List<Anomaly> anomalies, Instant now) {
        anomalies.forEach(anomaly -> lastForwarded.put(Key.of(anomaly), new Forwarded(now, anomaly.severity())));
    }

    int rememberedKeys() {
        return lastForwarded.size();
    }
}
