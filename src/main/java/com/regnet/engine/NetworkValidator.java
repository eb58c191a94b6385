package com.regnet.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.regnet.api.Confidence;
import com.regnet.api.EdgeClass;
import com.regnet.api.NetworkEdge;
import com.regnet.api.NetworkNode;
import com.regnet.api.NodeClass;
import com.regnet.api.NodeType;
import com.regnet.api.RegulatoryNetwork;
import com.regnet.io.NetworkTable;
import com.regnet.io.NetworkTable.Columns;
import com.regnet.io.RawTable;
import com.regnet.io.TableRow;

import lombok.extern.log4j.Log4j2;

/**
 * Turns normalized node and edge tables into a {@link RegulatoryNetwork}.
 *
 * <p>
 * Checks run in this order and the first failing one aborts:
 * <ol>
 * <li>node {@code Type} and {@code Class} enumerations ({@link SchemaException});
 * a {@code process} node has its class coerced to
 * {@code biological_activity} before its class cell is checked</li>
 * <li>unique, non-blank node labels ({@link SchemaException})</li>
 * <li>exactly one process node ({@link TraitCardinalityException})</li>
 * <li>every other node is a macromolecule ({@link ClassConsistencyException})</li>
 * <li>edge {@code Class} and {@code Confidence} enumerations
 * ({@link SchemaException})</li>
 * <li>every edge endpoint names a node ({@link DanglingReferenceException})</li>
 * </ol>
 * Node rows are indexed by label in a first pass; edges are resolved against
 * that index in a second pass. Edge rows that parse to an equal
 * {@link NetworkEdge} are kept once, in first-seen order. The logic-arc pairing convention is only
 * reported, see {@link LogicGateAdvisor}.
 */
@Log4j2
public final class NetworkValidator {

    public RegulatoryNetwork validate(RawTable nodeTable, RawTable edgeTable) {
        requireKind(nodeTable, NetworkTable.NODES);
        requireKind(edgeTable, NetworkTable.EDGES);

        List<NetworkNode> nodes = buildNodes(nodeTable);
        Map<String, NetworkNode> index = indexByLabel(nodes);
        checkTrait(nodes);
        checkClasses(nodes);

        List<NetworkEdge> edges = buildEdges(edgeTable);
        checkReferences(edges, index);

        RegulatoryNetwork network = new RegulatoryNetwork(nodes, edges);
        new LogicGateAdvisor().review(network);
        log.info("Validated network: {} nodes, {} edges, trait '{}'", network.nodeCount(), network.edgeCount(),
                network.trait().label());
        return network;
    }

    private static void requireKind(RawTable table, NetworkTable expected) {
        if (table.kind() != expected)
            throw new IllegalArgumentException("Expected " + expected.displayName() + " table, got "
                    + table.kind().displayName());
    }

    // ── Nodes ───────────────────────────────────────────────────────

    private List<NetworkNode> buildNodes(RawTable table) {
        int labelCol = table.columnIndex(Columns.NODES);
        int typeCol = table.columnIndex(Columns.TYPE);
        int classCol = table.columnIndex(Columns.CLASS);
        int compartmentCol = table.columnIndex(Columns.COMPARTMENT_REF);

        Set<String> badTypes = new LinkedHashSet<>();
        for (TableRow row : table.rows()) {
            if (NodeType.lookup(row.cell(typeCol)) == null)
                badTypes.add(row.cell(typeCol));
        }
        if (!badTypes.isEmpty())
            throw SchemaException.unsupportedValues(table.kind().displayName(), Columns.TYPE, badTypes);

        Set<String> badClasses = new LinkedHashSet<>();
        List<NetworkNode> nodes = new ArrayList<>(table.size());
        for (TableRow row : table.rows()) {
            String label = row.cell(labelCol);
            NodeType type = NodeType.lookup(row.cell(typeCol));
            NodeClass nodeClass = NodeClass.lookup(row.cell(classCol));
            if (type == NodeType.PROCESS && nodeClass != NodeClass.BIOLOGICAL_ACTIVITY) {
                log.debug("Coercing Class of process node '{}' from '{}' to {}", label, row.cell(classCol),
                        NodeClass.BIOLOGICAL_ACTIVITY.token());
                nodeClass = NodeClass.BIOLOGICAL_ACTIVITY;
            }
            if (nodeClass == null) {
                badClasses.add(row.cell(classCol));
                continue;
            }
            nodes.add(new NetworkNode(label, type, nodeClass, row.cell(compartmentCol)));
        }
        if (!badClasses.isEmpty())
            throw SchemaException.unsupportedValues(table.kind().displayName(), Columns.CLASS, badClasses);
        return nodes;
    }

    private static Map<String, NetworkNode> indexByLabel(List<NetworkNode> nodes) {
        Map<String, NetworkNode> index = new HashMap<>(nodes.size() * 2);
        Set<String> duplicates = new LinkedHashSet<>();
        for (NetworkNode n : nodes) {
            if (n.label().isEmpty())
                throw new SchemaException(NetworkTable.NODES.displayName(), Columns.NODES, Set.of(""),
                        "nodes table has a row with a blank label");
            if (index.putIfAbsent(n.label(), n) != null)
                duplicates.add(n.label());
        }
        if (!duplicates.isEmpty())
            throw new SchemaException(NetworkTable.NODES.displayName(), Columns.NODES, duplicates,
                    "Duplicate node labels: " + duplicates);
        return index;
    }

    private static void checkTrait(List<NetworkNode> nodes) {
        List<String> processLabels = nodes.stream()
                .filter(NetworkNode::isTrait)
                .map(NetworkNode::label)
                .toList();
        if (processLabels.size() != 1)
            throw new TraitCardinalityException(processLabels);
    }

    private static void checkClasses(List<NetworkNode> nodes) {
        List<String> offending = nodes.stream()
                .filter(n -> !n.isTrait() && n.nodeClass() != NodeClass.MACROMOLECULE)
                .map(NetworkNode::label)
                .toList();
        if (!offending.isEmpty())
            throw new ClassConsistencyException(offending);
    }

    // ── Edges ───────────────────────────────────────────────────────

    private List<NetworkEdge> buildEdges(RawTable table) {
        int sourceCol = table.columnIndex(Columns.SOURCE);
        int targetCol = table.columnIndex(Columns.TARGET);
        int classCol = table.columnIndex(Columns.CLASS);
        int confidenceCol = table.columnIndex(Columns.CONFIDENCE);
        int papersCol = table.columnIndex(Columns.PAPERS);
        int notesCol = table.columnIndex(Columns.NOTES);

        Set<String> badClasses = new LinkedHashSet<>();
        Set<String> badConfidence = new LinkedHashSet<>();
        for (TableRow row : table.rows()) {
            if (EdgeClass.lookup(row.cell(classCol)) == null)
                badClasses.add(row.cell(classCol));
            if (Confidence.lookup(row.cell(confidenceCol)) == null)
                badConfidence.add(row.cell(confidenceCol));
        }
        if (!badClasses.isEmpty())
            throw SchemaException.unsupportedValues(table.kind().displayName(), Columns.CLASS, badClasses);
        if (!badConfidence.isEmpty())
            throw SchemaException.unsupportedValues(table.kind().displayName(), Columns.CONFIDENCE, badConfidence);

        // rows spelled differently can still parse to the same edge; first one wins
        Set<NetworkEdge> edges = new LinkedHashSet<>(table.size() * 2);
        for (TableRow row : table.rows()) {
            edges.add(new NetworkEdge(row.cell(sourceCol), row.cell(targetCol),
                    EdgeClass.lookup(row.cell(classCol)), Confidence.lookup(row.cell(confidenceCol)),
                    splitPapers(row.cell(papersCol)), row.cell(notesCol)));
        }
        if (edges.size() < table.size())
            log.debug("Collapsed {} edge rows that parse to an existing edge", table.size() - edges.size());
        return new ArrayList<>(edges);
    }

    private static void checkReferences(List<NetworkEdge> edges, Map<String, NetworkNode> index) {
        Set<String> unknownSources = new LinkedHashSet<>();
        Set<String> unknownTargets = new LinkedHashSet<>();
        for (NetworkEdge e : edges) {
            if (!index.containsKey(e.source()))
                unknownSources.add(e.source());
            if (!index.containsKey(e.target()))
                unknownTargets.add(e.target());
        }
        if (!unknownSources.isEmpty() || !unknownTargets.isEmpty())
            throw new DanglingReferenceException(unknownSources, unknownTargets);
    }

    /** Splits a Papers cell on commas and semicolons, dropping empty pieces. */
    static List<String> splitPapers(String cell) {
        if (cell == null || cell.isBlank())
            return List.of();
        return Arrays.stream(cell.split("[,;]"))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
