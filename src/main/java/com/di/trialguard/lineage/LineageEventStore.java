package com.di.trialguard.lineage;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of finalized lineage events. Implementations can be in-memory or file-based; the query
 * side only needs the full batch, so there are no graph queries here.
 */
public interface LineageEventStore {

    /**
     * @throws IllegalArgumentException if an event with the same id is already stored
     */
    void save(LineageEvent event);

    Optional<LineageEvent> findById(String eventId);

    /** Every stored event, oldest first. */
    List<LineageEvent> findAll();

    /**
     * Increases on every save made through this instance. Callers cache derived structures per revision.
     */
    long revision();
}
