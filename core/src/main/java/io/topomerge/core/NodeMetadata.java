// file: src/main/java/io/topomerge/core/NodeMetadata.java
package io.topomerge.core;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable description of one node as seen by one or more probes.
 * <p>
 * Fields and their merge policies:
 *  - metadata:  free-form labels. On key collision the right-hand side wins.
 *  - counters:  "how many of these happened" counts. Summed per key.
 *  - adjacency: IDs of nodes this node has an observed edge towards. Union.
 * <p>
 * The label map may be absent (null), which is different from an empty map.
 * An absent map is carried through copies untouched so that
 * {@link Topology#validate()} can report it.
 */
public final class NodeMetadata {

    private static final NodeMetadata EMPTY = new NodeMetadata(Map.of(), Map.of(), IdList.empty());

    private final SortedMap<String, String> metadata; // null when absent
    private final SortedMap<String, Long> counters;
    private final IdList adjacency;

    /**
     * @param metadata  label map, or null for "absent"
     * @param counters  counter map, null is treated as empty; null keys or values are rejected
     * @param adjacency adjacency list, null is treated as empty
     * @throws NullPointerException if {@code counters} holds a null key or value
     */
    public NodeMetadata(Map<String, String> metadata, Map<String, Long> counters, IdList adjacency) {
        if (counters != null) {
            counters.forEach((k, v) -> {
                Objects.requireNonNull(k, "counter name");
                Objects.requireNonNull(v, () -> "counter " + k);
            });
        }
        this.metadata = metadata == null ? null : Collections.unmodifiableSortedMap(new TreeMap<>(metadata));
        this.counters = counters == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(counters));
        this.adjacency = adjacency == null ? IdList.empty() : adjacency;
    }

    /** Node metadata with an empty label map, no counters and no adjacency. */
    public static NodeMetadata empty() { return EMPTY; }

    /** Node metadata with the supplied labels and nothing else. */
    public static NodeMetadata of(Map<String, String> metadata) {
        return new NodeMetadata(Objects.requireNonNull(metadata, "metadata"), Map.of(), IdList.empty());
    }

    /** Labels in key order, or null when the label map is absent. */
    public Map<String, String> metadata() { return metadata; }

    public boolean hasMetadata() { return metadata != null; }

    /** Counters in key order (read-only). */
    public Map<String, Long> counters() { return counters; }

    public IdList adjacency() { return adjacency; }

    /** Fresh copy with the label map replaced. No validation is performed. */
    public NodeMetadata withMetadata(Map<String, String> m) {
        return new NodeMetadata(m, counters, adjacency);
    }

    /** Fresh copy with the counter map replaced. */
    public NodeMetadata withCounters(Map<String, Long> c) {
        return new NodeMetadata(metadata, c, adjacency);
    }

    /** Fresh copy with the adjacency list replaced. */
    public NodeMetadata withAdjacency(IdList a) {
        return new NodeMetadata(metadata, counters, a);
    }

    /** Fresh copy with {@code id} added to the adjacency list. */
    public NodeMetadata withAdjacent(String id) {
        return new NodeMetadata(metadata, counters, adjacency.add(id));
    }

    /** Value copy of this node metadata. */
    public NodeMetadata copy() {
        return new NodeMetadata(metadata, counters, adjacency.copy());
    }

    /**
     * Merge two node metadatas. Neither operand is modified.
     * <p>
     *  - labels:    other's value wins on conflict.
     *  - counters:  summed, missing keys count as 0.
     *  - adjacency: union.
     * <p>
     * The result has a label map unless both sides lack one.
     */
    public NodeMetadata merge(NodeMetadata other) {
        Objects.requireNonNull(other, "other");

        Map<String, String> labels = null;
        if (metadata != null || other.metadata != null) {
            labels = new TreeMap<>();
            if (metadata != null) labels.putAll(metadata);
            if (other.metadata != null) labels.putAll(other.metadata); // other takes precedence
        }

        var sums = new TreeMap<String, Long>(counters);
        other.counters.forEach((k, v) -> sums.merge(k, v, Long::sum));

        return new NodeMetadata(labels, sums, adjacency.merge(other.adjacency));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeMetadata n)) return false;
        return Objects.equals(metadata, n.metadata)
                && counters.equals(n.counters)
                && adjacency.equals(n.adjacency);
    }

    @Override public int hashCode() { return Objects.hash(metadata, counters, adjacency); }

    @Override public String toString() {
        return "NodeMetadata{metadata=" + metadata + ", counters=" + counters + ", adjacency=" + adjacency + "}";
    }
}
