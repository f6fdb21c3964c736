// file: src/main/java/io/topomerge/core/Topology.java
package io.topomerge.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable view of a network: edges and nodes, with metadata about each.
 * <p>
 * Edges are directional. An edge {@code src -> dst} is described twice:
 *  - by an entry in {@link #edgeMetadatas()} under the edge key, and
 *  - by {@code dst} in the adjacency list of {@code src}'s node metadata.
 * Keeping the two in step is the caller's job; {@link #validate()} checks it.
 * <p>
 * Design:
 *  - Value object: every operation returns a new Topology, neither the
 *    receiver nor the argument is ever modified.
 *  - Thread safe by construction, so many threads can share one instance.
 *    Callers replacing a "current" topology need only an atomic reference swap.
 *  - Merge is associative. Edge merge is commutative; node merge keeps the
 *    receiver's entry on conflict (see {@link NodeMetadatas}).
 *  - Only node entries and high-water marks are idempotent. Summed traffic
 *    counters double when a topology is merged with itself.
 */
public final class Topology {

    private static final Topology EMPTY = new Topology(EdgeMetadatas.empty(), NodeMetadatas.empty());

    private final EdgeMetadatas edgeMetadatas;
    private final NodeMetadatas nodeMetadatas;

    public Topology(EdgeMetadatas edgeMetadatas, NodeMetadatas nodeMetadatas) {
        this.edgeMetadatas = Objects.requireNonNull(edgeMetadatas, "edgeMetadatas");
        this.nodeMetadatas = Objects.requireNonNull(nodeMetadatas, "nodeMetadatas");
    }

    /** Topology with no nodes and no edges. */
    public static Topology empty() { return EMPTY; }

    public EdgeMetadatas edgeMetadatas() { return edgeMetadatas; }

    public NodeMetadatas nodeMetadatas() { return nodeMetadatas; }

    /**
     * Fresh topology with {@code nmd} stored under {@code nodeId}.
     * <p>
     * If a node already exists there, the stored value is
     * {@code nmd.merge(existing)}. Since the right-hand side of a node merge
     * wins on label conflicts, labels already stored win over those in
     * {@code nmd}; labels only {@code nmd} carries are added. Counters are
     * summed and adjacency is unioned with the existing node.
     */
    public Topology withNode(String nodeId, NodeMetadata nmd) {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(nmd, "nmd");
        NodeMetadata existing = nodeMetadatas.get(nodeId);
        if (existing != null) {
            nmd = nmd.merge(existing);
        }
        return new Topology(edgeMetadatas.copy(), nodeMetadatas.with(nodeId, nmd));
    }

    /**
     * Fresh topology with {@code emd} recorded for {@code edgeKey}. An existing
     * entry is combined with {@link EdgeMetadata#merge}. Adjacency is not touched.
     */
    public Topology withEdge(String edgeKey, EdgeMetadata emd) {
        Objects.requireNonNull(edgeKey, "edgeKey");
        Objects.requireNonNull(emd, "emd");
        EdgeMetadata existing = edgeMetadatas.get(edgeKey);
        EdgeMetadata stored = existing == null ? emd : existing.merge(emd);
        return new Topology(edgeMetadatas.with(edgeKey, stored), nodeMetadatas.copy());
    }

    /** {@link #withEdge(String, EdgeMetadata)} with the key built by the standard codec. */
    public Topology withEdge(String src, String dst, EdgeMetadata emd) {
        return withEdge(DelimitedIdCodec.standard().edgeKey(src, dst), emd);
    }

    /** Value copy of the Topology. */
    public Topology copy() {
        return new Topology(edgeMetadatas.copy(), nodeMetadatas.copy());
    }

    /** Field-wise merge of {@code other} into a copy of this topology. */
    public Topology merge(Topology other) {
        Objects.requireNonNull(other, "other");
        return new Topology(
                edgeMetadatas.merge(other.edgeMetadatas),
                nodeMetadatas.merge(other.nodeMetadatas)
        );
    }

    /**
     * Merge a batch of topologies left to right, starting from empty.
     * Cheaper than swapping a shared reference once per report.
     */
    public static Topology mergeAll(Iterable<Topology> topologies) {
        Objects.requireNonNull(topologies, "topologies");
        Topology acc = EMPTY;
        for (Topology t : topologies) {
            acc = acc.merge(t);
        }
        return acc;
    }

    /** {@link #validate(IdCodec)} with {@link DelimitedIdCodec#standard()}. */
    public void validate() throws TopologyValidationException {
        validate(DelimitedIdCodec.standard());
    }

    /**
     * Check the topology for inconsistencies and report all of them at once.
     *
     * @throws TopologyValidationException if at least one violation was found
     */
    public void validate(IdCodec codec) throws TopologyValidationException {
        List<String> errs = violations(codec);
        if (!errs.isEmpty()) {
            throw new TopologyValidationException(errs);
        }
    }

    /**
     * All violations of the topology invariants, empty when the topology is valid:
     *  - every edge key parses into source and destination,
     *  - the source node exists and lists the destination in its adjacency,
     *  - every node has a label map and a parseable ID,
     *  - every adjacency entry refers to an existing node and has edge metadata.
     */
    public List<String> violations(IdCodec codec) {
        Objects.requireNonNull(codec, "codec");
        var errs = new ArrayList<String>();

        for (String edgeKey : edgeMetadatas.keys()) {
            var edge = codec.parseEdgeKey(edgeKey);
            if (edge.isEmpty()) {
                errs.add(String.format("invalid edge ID \"%s\"", edgeKey));
                continue;
            }
            String srcId = edge.get().src();
            String dstId = edge.get().dst();
            NodeMetadata src = nodeMetadatas.get(srcId);
            if (src == null) {
                errs.add(String.format("node \"%s\" metadata missing for edge \"%s\"", srcId, edgeKey));
            } else if (!src.adjacency().contains(dstId)) {
                errs.add(String.format("adjacency of node \"%s\" missing destination \"%s\" (from edge \"%s\")",
                        srcId, dstId, edgeKey));
            }
        }

        for (var e : nodeMetadatas.asMap().entrySet()) {
            String nodeId = e.getKey();
            NodeMetadata nmd = e.getValue();
            if (!nmd.hasMetadata()) {
                errs.add(String.format("node ID \"%s\" has no metadata map", nodeId));
            }
            if (codec.parseNodeId(nodeId).isEmpty()) {
                errs.add(String.format("invalid node ID \"%s\"", nodeId));
            }
            for (String dstId : nmd.adjacency()) {
                if (!nodeMetadatas.containsKey(dstId)) {
                    errs.add(String.format("node metadata missing from adjacency \"%s\" -> \"%s\"", nodeId, dstId));
                }
                if (!edgeMetadatas.containsKey(codec.edgeKey(nodeId, dstId))) {
                    errs.add(String.format("edge metadata missing for adjacency \"%s\" -> \"%s\"", nodeId, dstId));
                }
            }
        }
        return errs;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Topology t)) return false;
        return edgeMetadatas.equals(t.edgeMetadatas) && nodeMetadatas.equals(t.nodeMetadatas);
    }

    @Override public int hashCode() { return Objects.hash(edgeMetadatas, nodeMetadatas); }

    @Override public String toString() {
        return "Topology{edges=" + edgeMetadatas + ", nodes=" + nodeMetadatas + "}";
    }
}
