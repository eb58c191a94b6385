package com.regnet.io;

import java.util.List;

/**
 * One data row, holding the required columns of its table in
 * {@link NetworkTable#columns()} order.
 *
 * @param rowNumber 1-based position among the data rows of its source
 */
public record TableRow(int rowNumber, List<String> cells) {

    public TableRow {
        cells = List.copyOf(cells);
    }

    public String cell(int column) {
        return cells.get(column);
    }
}
