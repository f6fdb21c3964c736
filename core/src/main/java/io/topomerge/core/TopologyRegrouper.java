package io.topomerge.core;

import java.util.ArrayList;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Projects a topology onto a coarser granularity, e.g. endpoints onto
 * processes or processes onto hosts.
 * <p>
 * Algorithm:
 *  - Every node ID is mapped to a group ID. Nodes of one group are combined
 *    with {@link NodeMetadata#merge} in node-ID order, so on label conflicts
 *    the node with the greatest ID wins. Adjacency entries are mapped too.
 *  - Every edge key is re-keyed to (group(src), group(dst)). Edges that land
 *    on the same key are distinct edges of one time window and are combined
 *    with {@link EdgeMetadata#flatten}.
 *  - Edge keys the codec cannot parse are kept unchanged.
 * <p>
 * Edges inside one group become self-edges and are kept.
 */
public final class TopologyRegrouper {

    private final Function<String, String> mapper;
    private final IdCodec codec;

    /**
     * @param mapper maps a node ID to its group ID, must not return null
     * @param codec  codec used to parse and rebuild edge keys
     */
    public TopologyRegrouper(Function<String, String> mapper, IdCodec codec) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public TopologyRegrouper(Function<String, String> mapper) {
        this(mapper, DelimitedIdCodec.standard());
    }

    /** Regrouped copy of {@code topology}; the input is not modified. */
    public Topology regroup(Topology topology) {
        Objects.requireNonNull(topology, "topology");

        var nodes = new TreeMap<String, NodeMetadata>();
        topology.nodeMetadatas().asMap().forEach((nodeId, nmd) -> {
            var adjacent = new ArrayList<String>(nmd.adjacency().size());
            for (String dst : nmd.adjacency()) {
                adjacent.add(group(dst));
            }
            NodeMetadata projected = nmd.withAdjacency(IdList.of(adjacent));
            nodes.merge(group(nodeId), projected, NodeMetadata::merge);
        });

        var edges = new TreeMap<String, EdgeMetadata>();
        topology.edgeMetadatas().asMap().forEach((edgeKey, emd) -> {
            String key = codec.parseEdgeKey(edgeKey)
                    .map(e -> codec.edgeKey(group(e.src()), group(e.dst())))
                    .orElse(edgeKey);
            edges.merge(key, emd, EdgeMetadata::flatten);
        });

        return new Topology(EdgeMetadatas.of(edges), NodeMetadatas.of(nodes));
    }

    private String group(String nodeId) {
        return Objects.requireNonNull(mapper.apply(nodeId), () -> "group for node " + nodeId);
    }
}
