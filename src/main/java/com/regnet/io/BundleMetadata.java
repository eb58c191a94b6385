package com.regnet.io;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Lineage record written next to the cleaned tables.
 *
 * @param idMapSample the first few label to identifier entries, in node order
 */
@JsonPropertyOrder({ "n_nodes", "n_edges", "id_map_sample" })
public record BundleMetadata(
        @JsonProperty("n_nodes") int nodeCount,
        @JsonProperty("n_edges") int edgeCount,
        @JsonProperty("id_map_sample") Map<String, String> idMapSample) {
}
