package com.di.trialguard.lineage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Read-only reachability index over a batch of finalized lineage events.
 *
 * <p>Built once from the batch with two maps keyed by asset location: the events that consumed a location
 * and the events that produced it. Queries are breadth-first with a visited set, so cyclic lineage
 * terminates, and a hard depth bound. Safe for concurrent queries; index new events by building a new index.
 */
public final class LineageIndex {

    public enum Direction { UPSTREAM, DOWNSTREAM }

    private final Map<String, List<LineageEvent>> byInput;
    private final Map<String, List<LineageEvent>> byOutput;
    private final int eventCount;

    private LineageIndex(Map<String, List<LineageEvent>> byInput, Map<String, List<LineageEvent>> byOutput,
                         int eventCount) {
        this.byInput = byInput;
        this.byOutput = byOutput;
        this.eventCount = eventCount;
    }

    public static LineageIndex of(Collection<LineageEvent> events) {
        Map<String, List<LineageEvent>> byInput = new HashMap<>();
        Map<String, List<LineageEvent>> byOutput = new HashMap<>();
        for (LineageEvent event : events) {
            for (DataAsset input : event.inputAssets()) {
                byInput.computeIfAbsent(input.location(), k -> new ArrayList<>()).add(event);
            }
            for (DataAsset output : event.outputAssets()) {
                byOutput.computeIfAbsent(output.location(), k -> new ArrayList<>()).add(event);
            }
        }
        return new LineageIndex(freeze(byInput), freeze(byOutput), events.size());
    }

    private static Map<String, List<LineageEvent>> freeze(Map<String, List<LineageEvent>> index) {
        Map<String, List<LineageEvent>> frozen = new HashMap<>();
        index.forEach((location, events) -> frozen.put(location, List.copyOf(events)));
        return Collections.unmodifiableMap(frozen);
    }

    public int size() {
        return eventCount;
    }

    /** Events that produced the location. */
    public List<LineageEvent> producersOf(String location) {
        return byOutput.getOrDefault(location, List.of());
    }

    /** Events that consumed the location. */
    public List<LineageEvent> consumersOf(String location) {
        return byInput.getOrDefault(location, List.of());
    }

    /**
     * Where did this data come from. Depth 0 is the seed: {@code maxDepth = 0} returns only the events that
     * produced {@code location}. Events come back in discovery order, each at most once.
     */
    public List<LineageEvent> getUpstream(String location, int maxDepth) {
        return traverse(location, maxDepth, byOutput, LineageEvent::inputAssets);
    }

    /** What depends on this data. Mirror of {@link #getUpstream(String, int)}. */
    public List<LineageEvent> getDownstream(String location, int maxDepth) {
        return traverse(location, maxDepth, byInput, LineageEvent::outputAssets);
    }

    public List<LineageEvent> get(Direction direction, String location, int maxDepth) {
        return switch (direction) {
            case UPSTREAM -> getUpstream(location, maxDepth);
            case DOWNSTREAM -> getDownstream(location, maxDepth);
        };
    }

    /** Copy of the events ordered by timestamp; ties keep discovery order. */
    public static List<LineageEvent> chronological(List<LineageEvent> events) {
        List<LineageEvent> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparing(LineageEvent::timestamp));
        return sorted;
    }

    private static List<LineageEvent> traverse(String seed,
                                               int maxDepth,
                                               Map<String, List<LineageEvent>> lookup,
                                               Function<LineageEvent, List<DataAsset>> next) {
        if (seed == null || maxDepth < 0) {
            return List.of();
        }
        Set<String> emitted = new HashSet<>();
        List<LineageEvent> result = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<Hop> queue = new ArrayDeque<>();

        visited.add(seed);
        queue.add(new Hop(seed, 0));
        while (!queue.isEmpty()) {
            Hop hop = queue.poll();
            for (LineageEvent event : lookup.getOrDefault(hop.location(), List.of())) {
                if (emitted.add(event.eventId())) {
                    result.add(event);
                }
                if (hop.depth() + 1 > maxDepth) {
                    continue;
                }
                for (DataAsset asset : next.apply(event)) {
                    // marked on enqueue so a location reached twice in one level is expanded once
                    if (visited.add(asset.location())) {
                        queue.add(new Hop(asset.location(), hop.depth() + 1));
                    }
                }
            }
        }
        return Collections.unmodifiableList(result);
    }

    private record Hop(String location, int depth) {
    }
}
