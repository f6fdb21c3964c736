package io.topomerge.codec.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON form of one node. A null or missing "Metadata" means the label map is absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeMetadataDto {
    @JsonProperty("Metadata")
    public Map<String, String> metadata;

    @JsonProperty("Counters")
    public Map<String, Long> counters;

    @JsonProperty("Adjacency")
    public List<String> adjacency;
}
