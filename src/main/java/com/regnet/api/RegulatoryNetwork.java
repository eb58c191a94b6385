package com.regnet.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated, immutable regulatory network.
 *
 * <p>
 * Node and edge order is the input order after normalization; layout and
 * rendering depend on it. Instances are only produced by
 * {@link com.regnet.engine.NetworkValidator}, which guarantees that there is
 * exactly one trait node and that every edge endpoint names a node.
 */
public final class RegulatoryNetwork {
    private final List<NetworkNode> nodes;
    private final List<NetworkEdge> edges;
    private final Map<String, NetworkNode> nodesByLabel;
    private final NetworkNode trait;

    public RegulatoryNetwork(List<NetworkNode> nodes, List<NetworkEdge> edges) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        Map<String, NetworkNode> index = new LinkedHashMap<>(nodes.size() * 2);
        NetworkNode found = null;
        for (NetworkNode n : this.nodes) {
            if (index.putIfAbsent(n.label(), n) != null)
                throw new IllegalArgumentException("Duplicate node label: " + n.label());
            if (n.isTrait())
                found = n;
        }
        this.nodesByLabel = Collections.unmodifiableMap(index);
        this.trait = found;
    }

    public List<NetworkNode> nodes() {
        return nodes;
    }

    public List<NetworkEdge> edges() {
        return edges;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean contains(String label) {
        return nodesByLabel.containsKey(label);
    }

    /** Returns the node with the given label. */
    public NetworkNode node(String label) {
        NetworkNode n = nodesByLabel.get(label);
        if (n == null)
            throw new IllegalArgumentException("Unknown node: " + label);
        return n;
    }

    /** The process node, or {@code null} for a network built outside the validator. */
    public NetworkNode trait() {
        return trait;
    }
}
