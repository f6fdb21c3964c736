package io.topomerge.core;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable collection of edge metadata, keyed by edge key
 * (source and destination node IDs joined by the {@link IdCodec}).
 * <p>
 * Merge policy: deep merge. Every key of the other side is folded into the
 * receiver's entry with {@link EdgeMetadata#merge}; a missing entry behaves
 * like {@link EdgeMetadata#empty()}.
 */
public final class EdgeMetadatas {

    private static final EdgeMetadatas EMPTY = new EdgeMetadatas(Collections.emptySortedMap());

    private final SortedMap<String, EdgeMetadata> entries;

    private EdgeMetadatas(SortedMap<String, EdgeMetadata> entries) {
        this.entries = entries;
    }

    public static EdgeMetadatas empty() { return EMPTY; }

    public static EdgeMetadatas of(Map<String, EdgeMetadata> entries) {
        Objects.requireNonNull(entries, "entries");
        var m = new TreeMap<String, EdgeMetadata>();
        entries.forEach((k, v) -> m.put(
                Objects.requireNonNull(k, "edge key"),
                Objects.requireNonNull(v, "edge metadata for " + k)));
        return wrap(m);
    }

    private static EdgeMetadatas wrap(TreeMap<String, EdgeMetadata> m) {
        return m.isEmpty() ? EMPTY : new EdgeMetadatas(Collections.unmodifiableSortedMap(m));
    }

    public EdgeMetadata get(String edgeKey) { return entries.get(edgeKey); }

    public boolean containsKey(String edgeKey) { return entries.containsKey(edgeKey); }

    public Set<String> keys() { return entries.keySet(); }

    public int size() { return entries.size(); }

    public boolean isEmpty() { return entries.isEmpty(); }

    /** Read-only view in key order. */
    public Map<String, EdgeMetadata> asMap() { return entries; }

    /** Fresh collection with {@code edgeKey} set to {@code emd}, replacing any existing entry. */
    public EdgeMetadatas with(String edgeKey, EdgeMetadata emd) {
        var m = copyEntries();
        m.put(Objects.requireNonNull(edgeKey, "edgeKey"), Objects.requireNonNull(emd, "emd"));
        return wrap(m);
    }

    /** Value copy of every entry. */
    public EdgeMetadatas copy() {
        return wrap(copyEntries());
    }

    /** Deep merge of {@code other} into a copy of this collection. */
    public EdgeMetadatas merge(EdgeMetadatas other) {
        Objects.requireNonNull(other, "other");
        var m = copyEntries();
        other.entries.forEach((k, v) ->
                m.put(k, m.getOrDefault(k, EdgeMetadata.empty()).merge(v)));
        return wrap(m);
    }

    private TreeMap<String, EdgeMetadata> copyEntries() {
        var m = new TreeMap<String, EdgeMetadata>();
        entries.forEach((k, v) -> m.put(k, v.copy()));
        return m;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EdgeMetadatas e)) return false;
        return entries.equals(e.entries);
    }

    @Override public int hashCode() { return entries.hashCode(); }

    @Override public String toString() { return entries.toString(); }
}
