package io.topomerge.core;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link IdCodec} based on two delimiters.
 * <p>
 * Format:
 *  - node ID:  [scope SCOPE_DELIM] localId     e.g. "host1;10.0.0.1;80" or "A"
 *  - edge key: srcNodeId EDGE_DELIM dstNodeId  e.g. "A|B"
 * <p>
 * A node ID is split at the first scope delimiter; an ID without one has an
 * empty scope. Node IDs must not contain the edge delimiter, otherwise their
 * edge keys would not be reversible.
 */
public final class DelimitedIdCodec implements IdCodec {

    public static final String SCOPE_DELIM = ";";
    public static final String EDGE_DELIM = "|";

    private static final DelimitedIdCodec STANDARD = new DelimitedIdCodec(SCOPE_DELIM, EDGE_DELIM);

    private final String scopeDelim;
    private final String edgeDelim;

    public DelimitedIdCodec(String scopeDelim, String edgeDelim) {
        Objects.requireNonNull(scopeDelim, "scopeDelim");
        Objects.requireNonNull(edgeDelim, "edgeDelim");
        if (scopeDelim.isEmpty() || edgeDelim.isEmpty()) {
            throw new IllegalArgumentException("delimiters must not be empty");
        }
        if (scopeDelim.contains(edgeDelim) || edgeDelim.contains(scopeDelim)) {
            throw new IllegalArgumentException("scope and edge delimiters must not overlap");
        }
        this.scopeDelim = scopeDelim;
        this.edgeDelim = edgeDelim;
    }

    /** Codec using ";" for scopes and "|" for edges. */
    public static DelimitedIdCodec standard() { return STANDARD; }

    /** Build a scoped node ID. */
    public String nodeId(String scope, String localId) {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(localId, "localId");
        return scope.isEmpty() ? localId : scope + scopeDelim + localId;
    }

    @Override
    public String edgeKey(String src, String dst) {
        Objects.requireNonNull(src, "src");
        Objects.requireNonNull(dst, "dst");
        return src + edgeDelim + dst;
    }

    @Override
    public Optional<EdgeId> parseEdgeKey(String edgeKey) {
        if (edgeKey == null) return Optional.empty();
        int idx = edgeKey.indexOf(edgeDelim);
        if (idx <= 0) return Optional.empty();
        String src = edgeKey.substring(0, idx);
        String dst = edgeKey.substring(idx + edgeDelim.length());
        if (dst.isEmpty() || dst.contains(edgeDelim)) return Optional.empty();
        return Optional.of(new EdgeId(src, dst));
    }

    @Override
    public Optional<NodeId> parseNodeId(String nodeId) {
        if (nodeId == null || nodeId.isEmpty() || nodeId.contains(edgeDelim)) return Optional.empty();
        int idx = nodeId.indexOf(scopeDelim);
        if (idx < 0) return Optional.of(new NodeId("", nodeId));
        String local = nodeId.substring(idx + scopeDelim.length());
        if (local.isEmpty()) return Optional.empty();
        return Optional.of(new NodeId(nodeId.substring(0, idx), local));
    }
}
