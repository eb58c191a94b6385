package com.regnet.render;

import java.util.Map;

import com.regnet.api.EdgeClass;
import com.regnet.api.NetworkEdge;
import com.regnet.api.NetworkNode;
import com.regnet.api.NodeClass;
import com.regnet.api.NodeType;
import com.regnet.api.RegulatoryNetwork;
import com.regnet.layout.GridPosition;
import com.regnet.layout.NetworkLayout;

/**
 * Writes a network as an SBGN-ML Process Description document.
 *
 * <p>
 * One {@code glyph} per node, in node order, followed by one {@code arc} per
 * edge, in edge order. Output depends only on the network, the identifier map
 * and the layout, so rendering the same input twice gives identical text.
 * The renderer produces a string; writing it anywhere is the caller's
 * business.
 */
public final class SbgnRenderer {
    public static final String NAMESPACE = "http://sbgn.org/libsbgn/0.3";
    public static final String LANGUAGE = "process description";
    static final String DEFAULT_ARC_CLASS = EdgeClass.POSITIVE_INFLUENCE.sbgnClass();

    private static final Map<String, String> ARC_CLASSES = Map.of(
            EdgeClass.POSITIVE_INFLUENCE.token(), EdgeClass.POSITIVE_INFLUENCE.sbgnClass(),
            EdgeClass.NEGATIVE_INFLUENCE.token(), EdgeClass.NEGATIVE_INFLUENCE.sbgnClass(),
            EdgeClass.LOGIC_ARC.token(), EdgeClass.LOGIC_ARC.sbgnClass(),
            EdgeClass.NECESSARY_STIMULATION.token(), EdgeClass.NECESSARY_STIMULATION.sbgnClass());

    public String render(RegulatoryNetwork network, Map<String, String> ids, NetworkLayout layout) {
        StringBuilder sb = new StringBuilder(256 + 160 * (network.nodeCount() + network.edgeCount()));
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
                .append("<sbgn xmlns=\"").append(NAMESPACE).append("\">\n")
                .append("  <map language=\"").append(LANGUAGE).append("\">\n");

        for (NetworkNode n : network.nodes()) {
            GridPosition p = layout.position(n.label());
            sb.append("    <glyph id=\"").append(XmlEscaper.escape(idOf(ids, n.label())))
                    .append("\" class=\"").append(glyphClass(n.type(), n.nodeClass())).append("\">\n")
                    .append("      <label text=\"").append(XmlEscaper.escape(n.label())).append("\"/>\n")
                    .append("      <bbox x=\"").append(p.x()).append("\" y=\"").append(p.y())
                    .append("\" w=\"").append(layout.glyphWidth()).append("\" h=\"").append(layout.glyphHeight())
                    .append("\"/>\n")
                    .append("    </glyph>\n");
        }

        for (NetworkEdge e : network.edges()) {
            String sid = XmlEscaper.escape(idOf(ids, e.source()));
            String tid = XmlEscaper.escape(idOf(ids, e.target()));
            sb.append("    <arc class=\"").append(arcClass(e.edgeClass().token()))
                    .append("\" source=\"").append(sid).append("\" target=\"").append(tid).append("\">")
                    .append("<port idref=\"").append(sid).append("\"/>")
                    .append("<port idref=\"").append(tid).append("\"/>")
                    .append("</arc>\n");
        }

        return sb.append("  </map>\n").append("</sbgn>\n").toString();
    }

    /**
     * The trait node (process, biological activity) is drawn as a biological
     * activity; any other node follows its class.
     */
    public static String glyphClass(NodeType type, NodeClass nodeClass) {
        if (type == NodeType.PROCESS && nodeClass == NodeClass.BIOLOGICAL_ACTIVITY)
            return NodeClass.BIOLOGICAL_ACTIVITY.sbgnClass();
        return nodeClass == NodeClass.MACROMOLECULE
                ? NodeClass.MACROMOLECULE.sbgnClass()
                : NodeClass.BIOLOGICAL_ACTIVITY.sbgnClass();
    }

    /** Arc class for an edge class token; unknown tokens fall back to positive influence. */
    public static String arcClass(String edgeClassToken) {
        return ARC_CLASSES.getOrDefault(edgeClassToken, DEFAULT_ARC_CLASS);
    }

    private static String idOf(Map<String, String> ids, String label) {
        String id = ids.get(label);
        if (id == null)
            throw new IllegalArgumentException("No identifier for node: " + label);
        return id;
    }
}
