package com.regnet.io;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Cleans raw table cells before validation.
 *
 * <ul>
 * <li>Strips leading and trailing whitespace from every cell; inner
 * whitespace is kept.</li>
 * <li>Repairs the logical-AND glyph when it arrives as UTF-8 bytes decoded as
 * Windows-1252 ({@value #AND_MOJIBAKE} becomes {@value #AND}).</li>
 * <li>Collapses edge rows that are identical in every column, keeping the
 * first occurrence in place.</li>
 * </ul>
 *
 * Normalizing an already normalized table returns an equal table.
 */
public final class TableNormalizer {
    private static final Logger log = LogManager.getLogger(TableNormalizer.class);

    /** U+2227 encoded as UTF-8 (E2 88 A7) and read back as cp1252. */
    public static final String AND_MOJIBAKE = "\u00e2\u02c6\u00a7";
    public static final String AND = "\u2227";

    public RawTable normalize(RawTable table) {
        List<TableRow> cleaned = new ArrayList<>(table.size());
        int repaired = 0;
        for (TableRow row : table.rows()) {
            List<String> cells = new ArrayList<>(row.cells().size());
            for (String cell : row.cells()) {
                String fixed = repairMojibake(cell);
                if (!fixed.equals(cell))
                    repaired++;
                cells.add(fixed.strip());
            }
            cleaned.add(new TableRow(row.rowNumber(), cells));
        }
        if (repaired > 0)
            log.debug("Repaired {} AND glyph(s) in {} table", repaired, table.kind().displayName());

        if (table.kind() == NetworkTable.EDGES)
            cleaned = dropDuplicates(cleaned);
        return new RawTable(table.kind(), cleaned);
    }

    public static String repairMojibake(String text) {
        if (text == null || !text.contains(AND_MOJIBAKE))
            return text == null ? "" : text;
        return text.replace(AND_MOJIBAKE, AND);
    }

    private static List<TableRow> dropDuplicates(List<TableRow> rows) {
        Set<List<String>> seen = new LinkedHashSet<>(rows.size() * 2);
        List<TableRow> unique = new ArrayList<>(rows.size());
        for (TableRow row : rows) {
            if (seen.add(row.cells()))
                unique.add(row);
        }
        int dropped = rows.size() - unique.size();
        if (dropped > 0)
            log.info("Collapsed {} duplicate edge row(s)", dropped);
        return unique;
    }
}
