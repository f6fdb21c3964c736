// file: src/main/java/io/topomerge/core/EdgeMetadata.java
package io.topomerge.core;

import java.util.Objects;

/**
 * Immutable set of counters a probe can collect about one directed edge.
 * <p>
 * Every field is an optional unsigned counter (see {@link CounterReducer}):
 * null means "not measured", which is different from zero. Fields are
 * independent of each other and merge independently.
 * <p>
 * Two ways of combining edge observations:
 *  - {@link #merge}:   same edge, different time windows.
 *  - {@link #flatten}: different edges, same time window.
 */
public final class EdgeMetadata {

    private static final EdgeMetadata EMPTY = new EdgeMetadata(null, null, null, null, null);

    private final Long egressPacketCount;
    private final Long ingressPacketCount;
    private final Long egressByteCount;   // transport layer
    private final Long ingressByteCount;  // transport layer
    private final Long maxConnCountTcp;

    public EdgeMetadata(
            Long egressPacketCount,
            Long ingressPacketCount,
            Long egressByteCount,
            Long ingressByteCount,
            Long maxConnCountTcp
    ) {
        this.egressPacketCount = egressPacketCount;
        this.ingressPacketCount = ingressPacketCount;
        this.egressByteCount = egressByteCount;
        this.ingressByteCount = ingressByteCount;
        this.maxConnCountTcp = maxConnCountTcp;
    }

    /** Edge metadata with no measured fields. */
    public static EdgeMetadata empty() { return EMPTY; }

    public Long egressPacketCount() { return egressPacketCount; }

    public Long ingressPacketCount() { return ingressPacketCount; }

    public Long egressByteCount() { return egressByteCount; }

    public Long ingressByteCount() { return ingressByteCount; }

    public Long maxConnCountTcp() { return maxConnCountTcp; }

    public EdgeMetadata withEgressPacketCount(Long v) {
        return new EdgeMetadata(v, ingressPacketCount, egressByteCount, ingressByteCount, maxConnCountTcp);
    }

    public EdgeMetadata withIngressPacketCount(Long v) {
        return new EdgeMetadata(egressPacketCount, v, egressByteCount, ingressByteCount, maxConnCountTcp);
    }

    public EdgeMetadata withEgressByteCount(Long v) {
        return new EdgeMetadata(egressPacketCount, ingressPacketCount, v, ingressByteCount, maxConnCountTcp);
    }

    public EdgeMetadata withIngressByteCount(Long v) {
        return new EdgeMetadata(egressPacketCount, ingressPacketCount, egressByteCount, v, maxConnCountTcp);
    }

    public EdgeMetadata withMaxConnCountTcp(Long v) {
        return new EdgeMetadata(egressPacketCount, ingressPacketCount, egressByteCount, ingressByteCount, v);
    }

    /** Value copy of this edge metadata. */
    public EdgeMetadata copy() {
        return new EdgeMetadata(egressPacketCount, ingressPacketCount, egressByteCount, ingressByteCount, maxConnCountTcp);
    }

    /**
     * Fold a newer observation of the same edge into this one.
     * Traffic counters are summed; the connection high-water mark takes the max.
     * Neither operand is modified.
     */
    public EdgeMetadata merge(EdgeMetadata other) {
        return combine(other, CounterReducer.MAX);
    }

    /**
     * Sum this edge with a different edge observed over the same window,
     * e.g. when collapsing fine-grained edges into one coarser edge.
     * <p>
     * The connection high-water mark is summed as well. The sum of two maxima
     * is not the true maximum of the union; it is a best-effort upper bound.
     */
    public EdgeMetadata flatten(EdgeMetadata other) {
        return combine(other, CounterReducer.SUM);
    }

    private EdgeMetadata combine(EdgeMetadata other, CounterReducer connReducer) {
        Objects.requireNonNull(other, "other");
        return new EdgeMetadata(
                CounterReducer.SUM.merge(egressPacketCount, other.egressPacketCount),
                CounterReducer.SUM.merge(ingressPacketCount, other.ingressPacketCount),
                CounterReducer.SUM.merge(egressByteCount, other.egressByteCount),
                CounterReducer.SUM.merge(ingressByteCount, other.ingressByteCount),
                connReducer.merge(maxConnCountTcp, other.maxConnCountTcp)
        );
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EdgeMetadata e)) return false;
        return Objects.equals(egressPacketCount, e.egressPacketCount)
                && Objects.equals(ingressPacketCount, e.ingressPacketCount)
                && Objects.equals(egressByteCount, e.egressByteCount)
                && Objects.equals(ingressByteCount, e.ingressByteCount)
                && Objects.equals(maxConnCountTcp, e.maxConnCountTcp);
    }

    @Override public int hashCode() {
        return Objects.hash(egressPacketCount, ingressPacketCount, egressByteCount, ingressByteCount, maxConnCountTcp);
    }

    @Override public String toString() {
        return "EdgeMetadata{egressPackets=" + unsigned(egressPacketCount)
                + ", ingressPackets=" + unsigned(ingressPacketCount)
                + ", egressBytes=" + unsigned(egressByteCount)
                + ", ingressBytes=" + unsigned(ingressByteCount)
                + ", maxConnTcp=" + unsigned(maxConnCountTcp) + "}";
    }

    private static String unsigned(Long v) {
        return v == null ? "-" : Long.toUnsignedString(v);
    }
}
