package io.topomerge.core;

import java.util.Optional;

/**
 * Encoding of node IDs and edge keys.
 * <p>
 * The topology algebra treats IDs as opaque strings. It needs a codec only
 * to build edge keys from node IDs and to check, during validation, that
 * edge keys and node IDs are well formed.
 */
public interface IdCodec {

    /** Reversible edge key for the directed edge {@code src -> dst}. */
    String edgeKey(String src, String dst);

    /** Split an edge key into its endpoints, or empty if the key is malformed. */
    Optional<EdgeId> parseEdgeKey(String edgeKey);

    /** Split a node ID into scope and local part, or empty if the ID is malformed. */
    Optional<NodeId> parseNodeId(String nodeId);

    /** Endpoints of a directed edge. */
    record EdgeId(String src, String dst) {}

    /**
     * Parsed node ID.
     *
     * @param scope   the probe scope (typically a host), empty for unscoped IDs
     * @param localId the node's ID within its topology
     */
    record NodeId(String scope, String localId) {}
}
