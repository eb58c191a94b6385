package com.regnet.layout;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.regnet.api.NetworkNode;
import com.regnet.api.NodeType;
import com.regnet.api.RegulatoryNetwork;
import com.regnet.io.PipelineConfig;

/**
 * Places nodes on a grid: one row per node type, in order of the type's first
 * appearance, and one column per node within its type, in input order.
 *
 * <pre>
 * x = originX + column * spacingX
 * y = originY + row * spacingY
 * </pre>
 *
 * Nodes of the same type never overlap as long as spacingX exceeds the glyph
 * width. Nothing is done about edges crossing glyphs.
 */
public final class GridLayout {
    private final PipelineConfig.LayoutSettings settings;

    public GridLayout(PipelineConfig.LayoutSettings settings) {
        this.settings = settings;
    }

    public NetworkLayout compute(RegulatoryNetwork network) {
        Map<NodeType, List<NetworkNode>> groups = new LinkedHashMap<>();
        for (NetworkNode n : network.nodes())
            groups.computeIfAbsent(n.type(), k -> new ArrayList<>()).add(n);

        Map<String, GridPosition> positions = new LinkedHashMap<>(network.nodeCount() * 2);
        List<String> rowTypes = new ArrayList<>(groups.size());
        int row = 0;
        for (Map.Entry<NodeType, List<NetworkNode>> group : groups.entrySet()) {
            rowTypes.add(group.getKey().token());
            List<NetworkNode> members = group.getValue();
            for (int col = 0; col < members.size(); col++) {
                positions.put(members.get(col).label(), new GridPosition(row, col,
                        settings.getOriginX() + col * settings.getSpacingX(),
                        settings.getOriginY() + row * settings.getSpacingY()));
            }
            row++;
        }
        return new NetworkLayout(positions, rowTypes, settings.getGlyphWidth(), settings.getGlyphHeight());
    }
}
