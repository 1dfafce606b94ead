package com.di.trialguard.lineage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.di.trialguard.lineage.LineageFixtures.edge;
import static com.di.trialguard.lineage.LineageFixtures.ids;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LineageIndex Tests")
class LineageIndexTest {

    @Test
    @DisplayName("Should walk a chain upstream and downstream")
    void testChain() {
        LineageIndex index = LineageIndex.of(List.of(edge("E1", "A", "B", 0), edge("E2", "B", "C", 1)));

        assertEquals(List.of("E2", "E1"), ids(index.getUpstream("C", 10)));
        assertEquals(List.of("E1", "E2"), ids(index.getDownstream("A", 10)));
        assertEquals(2, index.size());
    }

    @Test
    @DisplayName("Should terminate on a cycle and return each event once")
    void testCycle() {
        LineageIndex index = LineageIndex.of(List.of(edge("E1", "A", "B", 0), edge("E2", "B", "A", 1)));

        List<LineageEvent> upstream = index.getUpstream("A", 5);

        assertEquals(List.of("E2", "E1"), ids(upstream));
        assertEquals(List.of("E1", "E2"), ids(index.getDownstream("A", 5)));
    }

    @Test
    @DisplayName("Should return only direct producers and consumers at depth 0")
    void testDepthZero() {
        LineageIndex index = LineageIndex.of(List.of(
                edge("E1", "A", "B", 0), edge("E2", "B", "C", 1), edge("E3", "C", "D", 2)));

        assertEquals(List.of("E2"), ids(index.getUpstream("C", 0)));
        assertEquals(List.of("E3"), ids(index.getDownstream("C", 0)));
        assertEquals(List.of("E2", "E1"), ids(index.getUpstream("C", 1)));
    }

    @Test
    @DisplayName("Should emit a shared ancestor once when two paths reach it")
    void testFanInDedupe() {
        LineageIndex index = LineageIndex.of(List.of(
                edge("E1", "RAW", "LEFT", 0),
                edge("E2", "RAW", "RIGHT", 1),
                edge("E3", "LEFT", "JOINED", 2),
                edge("E4", "RIGHT", "JOINED", 3),
                edge("E0", "LANDING", "RAW", -1)));

        List<String> upstream = ids(index.getUpstream("JOINED", 10));

        assertEquals(List.of("E3", "E4", "E1", "E2", "E0"), upstream);
        assertEquals(upstream.size(), upstream.stream().distinct().count());
    }

    @Test
    @DisplayName("Should return nothing for unknown locations, null seeds and negative depth")
    void testEmptyResults() {
        LineageIndex index = LineageIndex.of(List.of(edge("E1", "A", "B", 0)));

        assertTrue(index.getUpstream("Z", 10).isEmpty());
        assertTrue(index.getUpstream(null, 10).isEmpty());
        assertTrue(index.getDownstream("A", -1).isEmpty());
        assertTrue(index.getUpstream("A", 10).isEmpty());
    }

    @Test
    @DisplayName("Should sort by timestamp on request while keeping discovery order by default")
    void testChronological() {
        LineageIndex index = LineageIndex.of(List.of(edge("E1", "A", "B", 0), edge("E2", "B", "C", 5)));

        List<LineageEvent> discovery = index.get(LineageIndex.Direction.UPSTREAM, "C", 10);

        assertEquals(List.of("E2", "E1"), ids(discovery));
        assertEquals(List.of("E1", "E2"), ids(LineageIndex.chronological(discovery)));
    }

    @Test
    @DisplayName("Should index every input and output location of an event")
    void testProducersAndConsumers() {
        LineageEvent merge = LineageEvent.builder()
                .eventId("M1")
                .eventType(LineageEventType.TRANSFORMATION)
                .timestamp(LineageFixtures.T0)
                .triggeredBy("glue:merge")
                .inputAssets(List.of(DataAsset.fromLocation("dm", DataLayer.SILVER, null),
                        DataAsset.fromLocation("ae", DataLayer.SILVER, null)))
                .outputAssets(List.of(DataAsset.fromLocation("adsl", DataLayer.GOLD, null)))
                .build();
        LineageIndex index = LineageIndex.of(List.of(merge));

        assertEquals(List.of("M1"), ids(index.consumersOf("dm")));
        assertEquals(List.of("M1"), ids(index.consumersOf("ae")));
        assertEquals(List.of("M1"), ids(index.producersOf("adsl")));
        assertTrue(index.producersOf("dm").isEmpty());
    }
}
