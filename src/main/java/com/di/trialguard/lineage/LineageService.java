package com.di.trialguard.lineage;

import com.di.trialguard.aspect.LogTransaction;
import com.di.trialguard.util.GovernanceMetrics;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Records lineage events and answers upstream/downstream queries.
 *
 * <p>Queries run against a {@link LineageIndex} built from the store's full event batch. Built indices are
 * cached per store revision (Caffeine), so repeated queries between writes reuse one index and any write
 * makes the next query rebuild.
 */
@Slf4j
@Service
public class LineageService {

    private final LineageEventStore store;
    private final LineageProperties properties;
    private final GovernanceMetrics metrics;
    private final Cache<Long, LineageIndex> indexCache;

    public LineageService(LineageEventStore store, LineageProperties properties, GovernanceMetrics metrics) {
        this.store = store;
        this.properties = properties;
        this.metrics = metrics;
        LineageProperties.IndexCache cacheConfig = properties.getIndexCache();
        this.indexCache = cacheConfig.isEnabled()
                ? Caffeine.newBuilder()
                        .maximumSize(cacheConfig.getMaxSize())
                        .expireAfterWrite(cacheConfig.getExpireAfterWriteSeconds(), TimeUnit.SECONDS)
                        .build()
                : null;
    }

    @LogTransaction(eventType = "LINEAGE_RECORD", transactionContext = "lineage_record",
            parameterNames = {"event"})
    public LineageEvent record(LineageEvent event) {
        store.save(event);
        metrics.recordLineageEvent(event.eventType().getTag());
        log.info("[LINEAGE] Recorded event={} type={} triggeredBy={} inputs={} outputs={}",
                event.eventId(), event.eventType(), event.triggeredBy(),
                event.inputAssets().size(), event.outputAssets().size());
        return event;
    }

    public Optional<LineageEvent> find(String eventId) {
        return store.findById(eventId);
    }

    @LogTransaction(eventType = "LINEAGE_QUERY", transactionContext = "lineage_upstream",
            parameterNames = {"location", "depth", "chronological"})
    public List<LineageEvent> getUpstream(String location, Integer depth, boolean chronological) {
        return query(LineageIndex.Direction.UPSTREAM, location, depth, chronological);
    }

    @LogTransaction(eventType = "LINEAGE_QUERY", transactionContext = "lineage_downstream",
            parameterNames = {"location", "depth", "chronological"})
    public List<LineageEvent> getDownstream(String location, Integer depth, boolean chronological) {
        return query(LineageIndex.Direction.DOWNSTREAM, location, depth, chronological);
    }

    private List<LineageEvent> query(LineageIndex.Direction direction, String location, Integer depth,
                                     boolean chronological) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Asset location cannot be null or blank");
        }
        int effectiveDepth = effectiveDepth(depth);
        long start = System.nanoTime();
        List<LineageEvent> events = currentIndex().get(direction, location, effectiveDepth);
        metrics.recordLineageQuery(direction.name().toLowerCase(), Duration.ofNanos(System.nanoTime() - start));
        log.debug("[LINEAGE] {} of '{}' depth={} -> {} event(s)", direction, location, effectiveDepth, events.size());
        return chronological ? LineageIndex.chronological(events) : events;
    }

    int effectiveDepth(Integer requested) {
        int depth = requested != null ? requested : properties.getDefaultDepth();
        if (depth < 0) {
            throw new IllegalArgumentException("Lineage depth must be >= 0, got " + depth);
        }
        if (depth > properties.getMaxDepth()) {
            log.debug("[LINEAGE] Requested depth {} capped at {}", depth, properties.getMaxDepth());
            return properties.getMaxDepth();
        }
        return depth;
    }

    LineageIndex currentIndex() {
        if (indexCache == null) {
            return LineageIndex.of(store.findAll());
        }
        return indexCache.get(store.revision(), revision -> {
            LineageIndex index = LineageIndex.of(store.findAll());
            log.debug("[LINEAGE] Built index of {} event(s) for revision {}", index.size(), revision);
            return index;
        });
    }
}
