package com.regnet.api;

import java.util.List;
import java.util.Objects;

/**
 * A directed causal edge between two node labels.
 *
 * @param papers citations in the order they were written
 */
public record NetworkEdge(String source, String target, EdgeClass edgeClass, Confidence confidence,
        List<String> papers, String notes) {

    public NetworkEdge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(edgeClass, "edgeClass");
        Objects.requireNonNull(confidence, "confidence");
        papers = papers == null ? List.of() : List.copyOf(papers);
        notes = notes == null ? "" : notes;
    }
}
