package io.topomerge.collector;

import io.topomerge.core.EdgeMetadata;
import io.topomerge.core.NodeMetadata;
import io.topomerge.core.Topology;
import io.topomerge.core.TopologyValidationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TopologyCollectorTest {

    /** One reporter's view: its own node talking to the shared hub. */
    private static Topology report(String nodeId) {
        return Topology.empty()
                .withNode(nodeId, NodeMetadata.of(Map.of("reporter", nodeId)).withAdjacent("hub"))
                .withNode("hub", NodeMetadata.of(Map.of("role", "hub")).withAdjacent("hub"))
                .withEdge(nodeId, "hub", EdgeMetadata.empty().withEgressPacketCount(1L).withMaxConnCountTcp(2L))
                .withEdge("hub", "hub", EdgeMetadata.empty().withIngressPacketCount(1L));
    }

    @Test
    void add_merges_reports_into_current() {
        var collector = new TopologyCollector();
        var before = collector.current();

        collector.add(report("a"));
        collector.add(report("b"));

        var t = collector.current();
        assertTrue(before.nodeMetadatas().isEmpty(), "earlier snapshots are never modified");
        assertEquals(3, t.nodeMetadatas().size());
        assertEquals(2L, t.edgeMetadatas().get("hub|hub").ingressPacketCount());
        assertEquals(2, collector.reportCount());
        assertEquals(2, collector.swapCount());
    }

    @Test
    void add_all_swaps_once_and_matches_sequential_adds() {
        var batch = List.of(report("a"), report("b"), report("c"));

        var batched = new TopologyCollector();
        batched.addAll(batch);

        var sequential = new TopologyCollector();
        batch.forEach(sequential::add);

        assertEquals(sequential.current(), batched.current());
        assertEquals(1, batched.swapCount());
        assertEquals(3, batched.reportCount());
    }

    @Test
    void empty_batch_is_a_no_op() {
        var collector = new TopologyCollector();
        collector.add(report("a"));
        var before = collector.current();

        assertSame(before, collector.addAll(List.of()));
        assertEquals(1, collector.swapCount());
    }

    @Test
    void concurrent_adds_converge_to_sequential_fold() throws Exception {
        int threads = 8, perThread = 50;
        var collector = new TopologyCollector();
        var all = new ArrayList<Topology>();
        for (int i = 0; i < threads * perThread; i++) {
            all.add(report("n" + i));
        }

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        try {
            var futures = new ArrayList<Future<?>>();
            for (int t = 0; t < threads; t++) {
                var slice = all.subList(t * perThread, (t + 1) * perThread);
                futures.add(pool.submit(() -> {
                    start.await();
                    slice.forEach(collector::add);
                    return null;
                }));
            }
            start.countDown();
            for (var f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        var result = collector.current();
        assertEquals(Topology.mergeAll(all), result);
        assertEquals((long) threads * perThread, result.edgeMetadatas().get("hub|hub").ingressPacketCount());
        assertEquals(threads * perThread, collector.reportCount());
        assertDoesNotThrow(() -> collector.validateCurrent());
    }

    @Test
    void validate_current_reports_inconsistency() {
        var collector = new TopologyCollector();
        collector.add(Topology.empty().withEdge("A|B", EdgeMetadata.empty()));

        var ex = assertThrows(TopologyValidationException.class, collector::validateCurrent);
        assertEquals(1, ex.violations().size());
    }

    @Test
    void reset_returns_collected_topology() {
        var collector = new TopologyCollector();
        collector.add(report("a"));

        var previous = collector.reset();

        assertEquals(2, previous.nodeMetadatas().size());
        assertEquals(Topology.empty(), collector.current());
    }
}
