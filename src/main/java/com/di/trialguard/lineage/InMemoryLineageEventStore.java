package com.di.trialguard.lineage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory lineage store. Suitable for single-node use and tests; events are lost on restart.
 * When {@code trialguard.lineage.store=file}, {@link FileLineageEventStore} is used instead.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "trialguard.lineage.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryLineageEventStore implements LineageEventStore {

    private final Map<String, LineageEvent> eventsById = new LinkedHashMap<>();
    private long revision;

    @Override
    public synchronized void save(LineageEvent event) {
        if (eventsById.containsKey(event.eventId())) {
            throw new IllegalArgumentException("Lineage event " + event.eventId() + " is already recorded");
        }
        eventsById.put(event.eventId(), event);
        revision++;
        log.debug("[LINEAGE] Stored event {} in memory (revision {})", event.eventId(), revision);
    }

    @Override
    public synchronized Optional<LineageEvent> findById(String eventId) {
        return Optional.ofNullable(eventsById.get(eventId));
    }

    @Override
    public synchronized List<LineageEvent> findAll() {
        return List.copyOf(new ArrayList<>(eventsById.values()));
    }

    @Override
    public synchronized long revision() {
        return revision;
    }
}
