package io.topomerge.core;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable collection of node metadata, keyed by node ID.
 * <p>
 * Merge policy: don't overwrite. Only IDs missing from the receiver are
 * copied in from the other side; an ID already present keeps the receiver's
 * metadata exactly as it is, with no field-level merge. Field-level rules
 * apply only through {@link NodeMetadata#merge} (and {@link Topology#withNode}).
 * This differs from {@link EdgeMetadatas#merge} on purpose.
 */
public final class NodeMetadatas {

    private static final NodeMetadatas EMPTY = new NodeMetadatas(Collections.emptySortedMap());

    private final SortedMap<String, NodeMetadata> entries;

    private NodeMetadatas(SortedMap<String, NodeMetadata> entries) {
        this.entries = entries;
    }

    public static NodeMetadatas empty() { return EMPTY; }

    public static NodeMetadatas of(Map<String, NodeMetadata> entries) {
        Objects.requireNonNull(entries, "entries");
        var m = new TreeMap<String, NodeMetadata>();
        entries.forEach((k, v) -> m.put(
                Objects.requireNonNull(k, "node ID"),
                Objects.requireNonNull(v, "node metadata for " + k)));
        return wrap(m);
    }

    private static NodeMetadatas wrap(TreeMap<String, NodeMetadata> m) {
        return m.isEmpty() ? EMPTY : new NodeMetadatas(Collections.unmodifiableSortedMap(m));
    }

    public NodeMetadata get(String nodeId) { return entries.get(nodeId); }

    public boolean containsKey(String nodeId) { return entries.containsKey(nodeId); }

    public Set<String> keys() { return entries.keySet(); }

    public int size() { return entries.size(); }

    public boolean isEmpty() { return entries.isEmpty(); }

    /** Read-only view in key order. */
    public Map<String, NodeMetadata> asMap() { return entries; }

    /** Fresh collection with {@code nodeId} set to {@code nmd}, replacing any existing entry. */
    public NodeMetadatas with(String nodeId, NodeMetadata nmd) {
        var m = copyEntries();
        m.put(Objects.requireNonNull(nodeId, "nodeId"), Objects.requireNonNull(nmd, "nmd"));
        return wrap(m);
    }

    /** Value copy of every entry. */
    public NodeMetadatas copy() {
        return wrap(copyEntries());
    }

    /** Copy of this collection plus the entries of {@code other} whose IDs are not present here. */
    public NodeMetadatas merge(NodeMetadatas other) {
        Objects.requireNonNull(other, "other");
        var m = copyEntries();
        other.entries.forEach((k, v) -> {
            if (!m.containsKey(k)) { // don't overwrite
                m.put(k, v.copy());
            }
        });
        return wrap(m);
    }

    private TreeMap<String, NodeMetadata> copyEntries() {
        var m = new TreeMap<String, NodeMetadata>();
        entries.forEach((k, v) -> m.put(k, v.copy()));
        return m;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeMetadatas n)) return false;
        return entries.equals(n.entries);
    }

    @Override public int hashCode() { return entries.hashCode(); }

    @Override public String toString() { return entries.toString(); }
}
