package io.topomerge.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Immutable sorted set of node IDs, used as a node's adjacency list.
 * <p>
 * Iteration order is lexicographic, so two lists holding the same IDs are
 * equal and iterate identically regardless of insertion order.
 */
public final class IdList implements Iterable<String> {

    private static final IdList EMPTY = new IdList(List.of());

    // Sorted, duplicate-free, unmodifiable.
    private final List<String> ids;

    private IdList(List<String> sortedIds) {
        this.ids = sortedIds;
    }

    public static IdList empty() { return EMPTY; }

    /** Build a list from the given IDs; duplicates collapse. */
    public static IdList of(String... ids) {
        return of(Arrays.asList(ids));
    }

    public static IdList of(Iterable<String> ids) {
        var set = new TreeSet<String>();
        for (String id : ids) {
            set.add(Objects.requireNonNull(id, "id"));
        }
        if (set.isEmpty()) return EMPTY;
        return new IdList(List.copyOf(set));
    }

    /** Return a list that also contains {@code id}. Adding a present ID returns an equal list. */
    public IdList add(String id) {
        Objects.requireNonNull(id, "id");
        int pos = Collections.binarySearch(ids, id);
        if (pos >= 0) return this;
        var out = new ArrayList<String>(ids.size() + 1);
        out.addAll(ids);
        out.add(-pos - 1, id);
        return new IdList(Collections.unmodifiableList(out));
    }

    public boolean contains(String id) {
        return id != null && Collections.binarySearch(ids, id) >= 0;
    }

    /** Set union of the two lists. */
    public IdList merge(IdList other) {
        Objects.requireNonNull(other, "other");
        if (other.ids.isEmpty()) return this;
        if (ids.isEmpty()) return other;

        // Linear merge of two sorted lists.
        var out = new ArrayList<String>(ids.size() + other.ids.size());
        int i = 0, j = 0;
        while (i < ids.size() && j < other.ids.size()) {
            int c = ids.get(i).compareTo(other.ids.get(j));
            if (c < 0) {
                out.add(ids.get(i++));
            } else if (c > 0) {
                out.add(other.ids.get(j++));
            } else {
                out.add(ids.get(i++));
                j++;
            }
        }
        while (i < ids.size()) out.add(ids.get(i++));
        while (j < other.ids.size()) out.add(other.ids.get(j++));
        return new IdList(Collections.unmodifiableList(out));
    }

    /** Value copy of this list. */
    public IdList copy() {
        return ids.isEmpty() ? EMPTY : new IdList(List.copyOf(ids));
    }

    public int size() { return ids.size(); }

    public boolean isEmpty() { return ids.isEmpty(); }

    /** Read-only view of the IDs in sorted order. */
    public List<String> asList() { return ids; }

    @Override public Iterator<String> iterator() { return ids.iterator(); }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdList other)) return false;
        return ids.equals(other.ids);
    }

    @Override public int hashCode() { return ids.hashCode(); }

    @Override public String toString() { return ids.toString(); }
}
