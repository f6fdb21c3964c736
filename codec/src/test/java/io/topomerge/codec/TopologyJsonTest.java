package io.topomerge.codec;

import io.topomerge.core.EdgeMetadata;
import io.topomerge.core.IdList;
import io.topomerge.core.NodeMetadata;
import io.topomerge.core.Topology;
import io.topomerge.core.TopologyValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TopologyJsonTest {

    @TempDir
    Path tmp;

    private static Topology decode(String json) {
        return TopologyJson.decode(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void decodes_report_in_wire_format() {
        Topology t = decode("""
                {
                  "EdgeMetadatas": {
                    "A|B": {"egress_packet_count": 10, "max_conn_count_tcp": 4}
                  },
                  "NodeMetadatas": {
                    "A": {"Metadata": {"role": "web"}, "Counters": {"conns": 2}, "Adjacency": ["B"]},
                    "B": {"Metadata": {}, "Counters": {}, "Adjacency": []}
                  }
                }
                """);

        var edge = t.edgeMetadatas().get("A|B");
        assertEquals(10L, edge.egressPacketCount());
        assertEquals(4L, edge.maxConnCountTcp());
        assertNull(edge.ingressPacketCount(), "missing counter must stay absent");

        var a = t.nodeMetadatas().get("A");
        assertEquals(Map.of("role", "web"), a.metadata());
        assertEquals(Map.of("conns", 2L), a.counters());
        assertEquals(IdList.of("B"), a.adjacency());
        assertDoesNotThrow(() -> t.validate());
    }

    @Test
    void absent_and_zero_counters_survive_encoding() {
        var t = Topology.empty()
                .withEdge("A|B", EdgeMetadata.empty().withEgressPacketCount(0L));

        String json = new String(TopologyJson.encode(t), StandardCharsets.UTF_8);
        assertTrue(json.contains("\"egress_packet_count\":0"), json);
        assertFalse(json.contains("ingress_packet_count"), json);

        var back = TopologyJson.decode(TopologyJson.encode(t));
        assertEquals(t, back);
        assertEquals(0L, back.edgeMetadatas().get("A|B").egressPacketCount());
        assertNull(back.edgeMetadatas().get("A|B").ingressPacketCount());
    }

    @Test
    void counters_use_full_unsigned_range() {
        var t = Topology.empty().withEdge("A|B", EdgeMetadata.empty().withEgressByteCount(-1L));

        String json = new String(TopologyJson.encode(t), StandardCharsets.UTF_8);
        assertTrue(json.contains("18446744073709551615"), json);
        assertEquals(-1L, TopologyJson.decode(TopologyJson.encode(t)).edgeMetadatas().get("A|B").egressByteCount());
    }

    @Test
    void counters_outside_unsigned_range_are_rejected() {
        assertThrows(TopologyCodecException.class, () -> decode("""
                {"EdgeMetadatas": {"A|B": {"egress_byte_count": 18446744073709551616}}}
                """));
        assertThrows(TopologyCodecException.class, () -> decode("""
                {"EdgeMetadatas": {"A|B": {"egress_byte_count": -1}}}
                """));
    }

    @Test
    void missing_label_map_decodes_as_absent_and_fails_validation() {
        var t = decode("""
                {"NodeMetadatas": {"A": {"Counters": {"n": 1}}}}
                """);

        assertFalse(t.nodeMetadatas().get("A").hasMetadata());
        var ex = assertThrows(TopologyValidationException.class, t::validate);
        assertTrue(ex.getMessage().contains("has no metadata map"));

        // and stays absent across a round trip
        assertFalse(TopologyJson.decode(TopologyJson.encode(t)).nodeMetadatas().get("A").hasMetadata());
    }

    @Test
    void unknown_properties_are_ignored() {
        var t = decode("""
                {"Version": 3, "NodeMetadatas": {"A": {"Metadata": {}, "Extra": true}}}
                """);
        assertEquals(NodeMetadata.empty(), t.nodeMetadatas().get("A"));
    }

    @Test
    void node_without_adjacency_decodes_with_empty_adjacency() {
        var t = decode("""
                {"NodeMetadatas": {"A": {"Metadata": {"role": "web"}}}}
                """);

        var a = t.nodeMetadatas().get("A");
        assertEquals(IdList.empty(), a.adjacency());
        assertEquals(Map.of("role", "web"), a.metadata());
        assertThrows(TopologyCodecException.class, () -> decode("""
                {"NodeMetadatas": {"A": {"Metadata": {}, "Adjacency": ["B", null]}}}
                """));
    }

    @Test
    void fractional_counters_are_rejected() {
        assertThrows(TopologyCodecException.class, () -> decode("""
                {"EdgeMetadatas": {"A|B": {"egress_packet_count": 1.9}}}
                """));
        assertThrows(TopologyCodecException.class, () -> decode("""
                {"NodeMetadatas": {"A": {"Metadata": {}, "Counters": {"n": 2.7}}}}
                """));
    }

    @Test
    void malformed_input_raises_codec_exception() {
        assertThrows(TopologyCodecException.class, () -> decode("{not json"));
        assertThrows(TopologyCodecException.class, () -> decode("null"));
        assertThrows(TopologyCodecException.class, () -> decode("""
                {"NodeMetadatas": {"A": null}}
                """));
        assertThrows(TopologyCodecException.class, () -> decode("""
                {"NodeMetadatas": {"A": {"Metadata": {"k": null}}}}
                """));
    }

    @Test
    void file_round_trip() throws Exception {
        var t = Topology.empty()
                .withNode("h1;A", NodeMetadata.of(Map.of("role", "web")).withAdjacent("h2;B"))
                .withNode("h2;B", NodeMetadata.of(Map.of("role", "db")))
                .withEdge("h1;A", "h2;B", new EdgeMetadata(1L, 2L, 3L, 4L, 5L));

        Path file = tmp.resolve("report.json");
        TopologyJson.write(file, t);

        assertTrue(Files.size(file) > 0);
        assertEquals(t, TopologyJson.read(file));
    }

    @Test
    void reading_bad_file_names_the_file() throws Exception {
        Path file = tmp.resolve("bad.json");
        Files.writeString(file, "[1, 2");

        var ex = assertThrows(TopologyCodecException.class, () -> TopologyJson.read(file));
        assertTrue(ex.getMessage().contains("bad.json"));
        assertThrows(java.io.IOException.class, () -> TopologyJson.read(tmp.resolve("missing.json")));
    }
}
