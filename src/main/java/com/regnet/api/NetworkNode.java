package com.regnet.api;

import java.util.Objects;

/**
 * A node of the regulatory network. The label is the natural key.
 */
public record NetworkNode(String label, NodeType type, NodeClass nodeClass, String compartment) {

    public NetworkNode {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(nodeClass, "nodeClass");
        compartment = compartment == null ? "" : compartment;
    }

    /** True for the single trait node that represents the modelled outcome. */
    public boolean isTrait() {
        return type == NodeType.PROCESS;
    }
}
