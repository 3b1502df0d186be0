package com.pulsewatch.agent.baseline;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cross-cycle seasonal baselines. Readers always see an immutable snapshot; the pipeline
 * folds a cycle's observations in with a single {@link #commit(Collection)} once detection
 * is complete, so a cycle never compares against a baseline it has already updated.
 */
@Component
public class BaselineCache {

    private static final Logger log = LoggerFactory.getLogger(BaselineCache.class);

    private final AtomicReference<Map<BaselineKey, SeasonalBaseline>> current = new AtomicReference<>(Map.of());
    private final AtomicLong generation = new AtomicLong();

    public Optional<SeasonalBaseline> lookup(BaselineKey key) {
        return Optional.ofNullable(current.get().get(key));
    }

    public Map<BaselineKey, SeasonalBaseline> snapshot() {
        return current.get();
    }

    public long generation() {
        return generation.get();
    }

    public void commit(Collection<BaselineObservation> observations) {
        if (observations.isEmpty()) {
            return;
        }
        Map<BaselineKey, SeasonalBaseline> next = new HashMap<>(current.get());
        for (BaselineObservation observation : observations) {
            next.merge(observation.key(), SeasonalBaseline.first(observation.windowMean()),
                    (existing, ignored) -> existing.plus(observation.windowMean()));
        }
        current.set(Map.copyOf(next));
        long gen = generation.incrementAndGet();
        log.debug("Baseline cache generation {}: {} observations folded, {} buckets tracked",
                gen, observations.size(), next.size());
    }

    public void clear() {
        current.set(Map.of());
        generation.incrementAndGet();
    }
}
