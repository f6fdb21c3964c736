// file: src/main/java/io/topomerge/codec/TopologyJson.java
package io.topomerge.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.topomerge.codec.dto.EdgeMetadataDto;
import io.topomerge.codec.dto.NodeMetadataDto;
import io.topomerge.codec.dto.TopologyDto;
import io.topomerge.core.EdgeMetadata;
import io.topomerge.core.EdgeMetadatas;
import io.topomerge.core.IdList;
import io.topomerge.core.NodeMetadata;
import io.topomerge.core.NodeMetadatas;
import io.topomerge.core.Topology;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * JSON wire format for topology reports.
 * <p>
 * Layout (see {@link TopologyDto}):
 *  - "EdgeMetadatas": edge key -> counters, unmeasured counters omitted,
 *    values written as unsigned decimal numbers.
 *  - "NodeMetadatas": node ID -> {"Metadata", "Counters", "Adjacency"}.
 * <p>
 * Absent counters and absent label maps survive a round trip, so a decoded
 * report merges and validates exactly like the topology that was encoded.
 * Unknown properties are ignored. Counters must be integers: a fractional
 * value is rejected rather than truncated.
 */
public final class TopologyJson {

    private static final BigInteger MAX_UNSIGNED_64 = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private TopologyJson() {
        // utility
    }

    /** Compact JSON bytes for {@code topology}. */
    public static byte[] encode(Topology topology) {
        return encode(topology, false);
    }

    public static byte[] encode(Topology topology, boolean pretty) {
        try {
            var writer = pretty ? MAPPER.writerWithDefaultPrettyPrinter() : MAPPER.writer();
            return writer.writeValueAsBytes(toDto(topology));
        } catch (JsonProcessingException e) {
            throw new TopologyCodecException("Failed to encode topology", e);
        }
    }

    /** Decode a report. */
    public static Topology decode(byte[] json) {
        try {
            return fromDto(MAPPER.readValue(json, TopologyDto.class));
        } catch (IOException e) {
            throw new TopologyCodecException("Malformed topology JSON", e);
        }
    }

    /** Write {@code topology} as pretty-printed JSON to {@code path}. */
    public static void write(Path path, Topology topology) throws IOException {
        Files.write(path, encode(topology, true));
    }

    /**
     * Read a report from {@code path}.
     *
     * @throws IOException            if the file cannot be read
     * @throws TopologyCodecException if the content is not a valid report
     */
    public static Topology read(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        try {
            return decode(bytes);
        } catch (TopologyCodecException e) {
            throw new TopologyCodecException("Malformed report " + path + ": " + e.getMessage(), e.getCause());
        }
    }

    // ----------------- mapping -----------------

    static TopologyDto toDto(Topology t) {
        var dto = new TopologyDto();
        dto.edgeMetadatas = new LinkedHashMap<>();
        t.edgeMetadatas().asMap().forEach((k, v) -> dto.edgeMetadatas.put(k, toDto(v)));
        dto.nodeMetadatas = new LinkedHashMap<>();
        t.nodeMetadatas().asMap().forEach((k, v) -> dto.nodeMetadatas.put(k, toDto(v)));
        return dto;
    }

    private static EdgeMetadataDto toDto(EdgeMetadata e) {
        var dto = new EdgeMetadataDto();
        dto.egressPacketCount = unsigned(e.egressPacketCount());
        dto.ingressPacketCount = unsigned(e.ingressPacketCount());
        dto.egressByteCount = unsigned(e.egressByteCount());
        dto.ingressByteCount = unsigned(e.ingressByteCount());
        dto.maxConnCountTcp = unsigned(e.maxConnCountTcp());
        return dto;
    }

    private static NodeMetadataDto toDto(NodeMetadata n) {
        var dto = new NodeMetadataDto();
        dto.metadata = n.metadata();
        dto.counters = n.counters();
        dto.adjacency = n.adjacency().asList();
        return dto;
    }

    static Topology fromDto(TopologyDto dto) {
        if (dto == null) throw new TopologyCodecException("Report must be a JSON object");

        var edges = new TreeMap<String, EdgeMetadata>();
        if (dto.edgeMetadatas != null) {
            dto.edgeMetadatas.forEach((k, v) -> {
                if (v == null) throw new TopologyCodecException("Edge " + k + " has null metadata");
                edges.put(k, fromDto(k, v));
            });
        }

        var nodes = new TreeMap<String, NodeMetadata>();
        if (dto.nodeMetadatas != null) {
            dto.nodeMetadatas.forEach((k, v) -> {
                if (v == null) throw new TopologyCodecException("Node " + k + " has null metadata");
                nodes.put(k, fromDto(k, v));
            });
        }
        return new Topology(EdgeMetadatas.of(edges), NodeMetadatas.of(nodes));
    }

    private static EdgeMetadata fromDto(String edgeKey, EdgeMetadataDto dto) {
        return new EdgeMetadata(
                signed(edgeKey, "egress_packet_count", dto.egressPacketCount),
                signed(edgeKey, "ingress_packet_count", dto.ingressPacketCount),
                signed(edgeKey, "egress_byte_count", dto.egressByteCount),
                signed(edgeKey, "ingress_byte_count", dto.ingressByteCount),
                signed(edgeKey, "max_conn_count_tcp", dto.maxConnCountTcp)
        );
    }

    private static NodeMetadata fromDto(String nodeId, NodeMetadataDto dto) {
        if (dto.metadata != null && dto.metadata.containsValue(null)) {
            throw new TopologyCodecException("Node " + nodeId + " has a null label value");
        }
        if (dto.counters != null && dto.counters.containsValue(null)) {
            throw new TopologyCodecException("Node " + nodeId + " has a null counter value");
        }
        // a missing "Adjacency" key is an empty list
        List<String> adjacency = dto.adjacency == null ? List.of() : dto.adjacency;
        if (adjacency.stream().anyMatch(Objects::isNull)) {
            throw new TopologyCodecException("Node " + nodeId + " has a null adjacency entry");
        }
        return new NodeMetadata(dto.metadata, countersOrEmpty(dto.counters), IdList.of(adjacency));
    }

    private static Map<String, Long> countersOrEmpty(Map<String, Long> counters) {
        return counters == null ? Map.of() : counters;
    }

    private static BigInteger unsigned(Long v) {
        return v == null ? null : new BigInteger(Long.toUnsignedString(v));
    }

    private static Long signed(String edgeKey, String field, BigInteger v) {
        if (v == null) return null;
        if (v.signum() < 0 || v.compareTo(MAX_UNSIGNED_64) > 0) {
            throw new TopologyCodecException(
                    "Edge " + edgeKey + " field " + field + " out of unsigned 64-bit range: " + v);
        }
        return v.longValue(); // low 64 bits, i.e. the unsigned value
    }
}
