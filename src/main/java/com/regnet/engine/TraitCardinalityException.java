package com.regnet.engine;

import java.util.List;

/**
 * The network does not have exactly one process (trait) node.
 */
public final class TraitCardinalityException extends NetworkValidationException {
    private static final long serialVersionUID = 1L;

    private final List<String> processLabels;

    public TraitCardinalityException(List<String> processLabels) {
        super(processLabels.isEmpty()
                ? "No node has Type=process; exactly one trait node is required"
                : "Exactly one node may have Type=process, found " + processLabels.size() + ": " + processLabels);
        this.processLabels = List.copyOf(processLabels);
    }

    public List<String> processLabels() {
        return processLabels;
    }
}
