package io.topomerge.codec.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * JSON form of one edge's counters. Unmeasured counters are omitted.
 * BigInteger keeps the full unsigned 64-bit range on the wire.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EdgeMetadataDto {
    @JsonProperty("egress_packet_count")
    public BigInteger egressPacketCount;

    @JsonProperty("ingress_packet_count")
    public BigInteger ingressPacketCount;

    @JsonProperty("egress_byte_count")
    public BigInteger egressByteCount;

    @JsonProperty("ingress_byte_count")
    public BigInteger ingressByteCount;

    @JsonProperty("max_conn_count_tcp")
    public BigInteger maxConnCountTcp;
}
