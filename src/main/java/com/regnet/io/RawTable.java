package com.regnet.io;

import java.util.List;

/**
 * Untyped rows of one input table, in input order.
 */
public record RawTable(NetworkTable kind, List<TableRow> rows) {

    public RawTable {
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    /** Index of a required column in every row of this table. */
    public int columnIndex(String column) {
        int idx = kind.columns().indexOf(column);
        if (idx < 0)
            throw new IllegalArgumentException("Unknown " + kind.displayName() + " column: " + column);
        return idx;
    }

    public String cell(int row, String column) {
        return rows.get(row).cell(columnIndex(column));
    }
}
