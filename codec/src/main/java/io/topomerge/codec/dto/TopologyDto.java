// file: src/main/java/io/topomerge/codec/dto/TopologyDto.java
package io.topomerge.codec.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * JSON form of a topology report.
 * Example:
 *   {
 *     "EdgeMetadatas": { "A|B": { "egress_packet_count": 10 } },
 *     "NodeMetadatas": { "A": { "Metadata": {"role": "db"}, "Counters": {}, "Adjacency": ["B"] } }
 *   }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TopologyDto {
    @JsonProperty("EdgeMetadatas")
    public Map<String, EdgeMetadataDto> edgeMetadatas;

    @JsonProperty("NodeMetadatas")
    public Map<String, NodeMetadataDto> nodeMetadatas;
}
