package com.regnet.layout;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Positions of every node, keyed by label, plus the row order of the node
 * types. Read-only.
 */
public final class NetworkLayout {
    private final Map<String, GridPosition> positions;
    private final List<String> rowTypes;
    private final int glyphWidth;
    private final int glyphHeight;

    NetworkLayout(Map<String, GridPosition> positions, List<String> rowTypes, int glyphWidth, int glyphHeight) {
        this.positions = Collections.unmodifiableMap(positions);
        this.rowTypes = List.copyOf(rowTypes);
        this.glyphWidth = glyphWidth;
        this.glyphHeight = glyphHeight;
    }

    public GridPosition position(String label) {
        GridPosition p = positions.get(label);
        if (p == null)
            throw new IllegalArgumentException("No position for node: " + label);
        return p;
    }

    /** Node type tokens in row order. */
    public List<String> rowTypes() {
        return rowTypes;
    }

    public Map<String, GridPosition> positions() {
        return positions;
    }

    public int glyphWidth() {
        return glyphWidth;
    }

    public int glyphHeight() {
        return glyphHeight;
    }
}
