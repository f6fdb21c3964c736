package io.topomerge.core;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The two collection types merge differently: edges deep-merge,
 * nodes keep the receiver's entry.
 */
class MetadatasMergeTest {

    @Test
    void node_collection_merge_keeps_receiver_entry_but_node_merge_lets_other_win() {
        var nodeA = NodeMetadata.of(Map.of("x", "1"));
        var nodeB = NodeMetadata.of(Map.of("x", "2"));
        var receiver = NodeMetadatas.of(Map.of("A", nodeA));
        var other = NodeMetadatas.of(Map.of("A", nodeB));

        // collection level: don't overwrite
        assertEquals(Map.of("x", "1"), receiver.merge(other).get("A").metadata());
        // metadata level: other wins
        assertEquals(Map.of("x", "2"), nodeA.merge(nodeB).metadata());
    }

    @Test
    void node_collection_merge_does_not_combine_counters_or_adjacency_of_shared_ids() {
        var mine = NodeMetadata.empty().withCounters(Map.of("n", 1L)).withAdjacent("B");
        var theirs = NodeMetadata.empty().withCounters(Map.of("n", 5L)).withAdjacent("C");

        var merged = NodeMetadatas.of(Map.of("A", mine)).merge(NodeMetadatas.of(Map.of("A", theirs)));

        assertEquals(mine, merged.get("A"));
    }

    @Test
    void node_collection_merge_copies_new_ids() {
        var receiver = NodeMetadatas.of(Map.of("A", NodeMetadata.empty()));
        var other = NodeMetadatas.of(Map.of("B", NodeMetadata.of(Map.of("role", "db"))));

        var merged = receiver.merge(other);
        assertEquals(2, merged.size());
        assertEquals(Map.of("role", "db"), merged.get("B").metadata());
        // inputs untouched
        assertEquals(1, receiver.size());
        assertFalse(receiver.containsKey("B"));
    }

    @Test
    void edge_collection_merge_deep_merges_shared_keys() {
        var left = EdgeMetadatas.of(Map.of(
                "A|B", new EdgeMetadata(10L, null, null, null, 4L),
                "A|C", new EdgeMetadata(1L, null, null, null, null)));
        var right = EdgeMetadatas.of(Map.of(
                "A|B", new EdgeMetadata(5L, 2L, null, null, 6L),
                "B|C", new EdgeMetadata(null, null, 7L, null, null)));

        var merged = left.merge(right);

        assertEquals(new EdgeMetadata(15L, 2L, null, null, 6L), merged.get("A|B"));
        assertEquals(new EdgeMetadata(1L, null, null, null, null), merged.get("A|C"));
        assertEquals(new EdgeMetadata(null, null, 7L, null, null), merged.get("B|C"));
    }

    @Test
    void edge_collection_merge_is_commutative() {
        var a = EdgeMetadatas.of(Map.of(
                "A|B", new EdgeMetadata(10L, 1L, null, 3L, 4L),
                "A|C", new EdgeMetadata(null, 2L, 2L, null, 1L)));
        var b = EdgeMetadatas.of(Map.of(
                "A|B", new EdgeMetadata(5L, null, 8L, 3L, 9L),
                "C|A", new EdgeMetadata(1L, 1L, 1L, 1L, 1L)));

        assertEquals(a.merge(b), b.merge(a));
    }

    @Test
    void with_replaces_entry_in_a_fresh_collection() {
        var base = EdgeMetadatas.empty().with("A|B", EdgeMetadata.empty().withEgressByteCount(1L));
        var replaced = base.with("A|B", EdgeMetadata.empty().withEgressByteCount(9L));

        assertEquals(1L, base.get("A|B").egressByteCount());
        assertEquals(9L, replaced.get("A|B").egressByteCount());
        assertThrows(UnsupportedOperationException.class,
                () -> replaced.asMap().put("X|Y", EdgeMetadata.empty()));
    }

    @Test
    void copies_are_equal_but_distinct() {
        var edges = EdgeMetadatas.of(Map.of("A|B", new EdgeMetadata(1L, 2L, 3L, 4L, 5L)));
        var nodes = NodeMetadatas.of(Map.of("A", NodeMetadata.of(Map.of("k", "v")).withAdjacent("B")));

        assertEquals(edges, edges.copy());
        assertNotSame(edges.get("A|B"), edges.copy().get("A|B"));
        assertEquals(nodes, nodes.copy());
        assertNotSame(nodes.get("A"), nodes.copy().get("A"));
    }
}
