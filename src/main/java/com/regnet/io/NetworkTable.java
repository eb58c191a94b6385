package com.regnet.io;

import java.util.List;
import java.util.Map;

/**
 * The two input tables and their required columns.
 *
 * <p>
 * Some authors spell a column header differently; {@link #canonicalColumn}
 * maps each accepted spelling to its canonical column and is consulted once,
 * when the header row is read.
 */
public enum NetworkTable {
    NODES("nodes",
            List.of(Columns.NODES, Columns.TYPE, Columns.CLASS, Columns.COMPARTMENT_REF),
            Map.of()),
    EDGES("edges",
            List.of(Columns.SOURCE, Columns.TARGET, Columns.CLASS, Columns.CONFIDENCE, Columns.PAPERS,
                    Columns.NOTES),
            Map.of("Notes short explanation of edge", Columns.NOTES));

    private final String displayName;
    private final List<String> columns;
    private final Map<String, String> aliases;

    NetworkTable(String displayName, List<String> columns, Map<String, String> aliases) {
        this.displayName = displayName;
        this.columns = columns;
        this.aliases = aliases;
    }

    public String displayName() {
        return displayName;
    }

    /** Required columns, in output order. */
    public List<String> columns() {
        return columns;
    }

    /** Maps a header cell to its canonical column name. */
    public String canonicalColumn(String header) {
        return aliases.getOrDefault(header, header);
    }

    /** Column names shared by both tables. */
    public static final class Columns {
        public static final String NODES = "Nodes";
        public static final String TYPE = "Type";
        public static final String CLASS = "Class";
        public static final String COMPARTMENT_REF = "compartmentRef";
        public static final String SOURCE = "source";
        public static final String TARGET = "target";
        public static final String CONFIDENCE = "Confidence";
        public static final String PAPERS = "Papers";
        public static final String NOTES = "Notes";

        private Columns() {
        }
    }
}
