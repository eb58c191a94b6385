package com.regnet.io;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.regnet.engine.SchemaException;

import lombok.extern.log4j.Log4j2;

/**
 * Reads a network table from CSV.
 *
 * <p>
 * Only column presence is checked here; cell values are left untouched for
 * {@link TableNormalizer} and the validator. Columns that are not required are
 * dropped, row order is preserved, blank lines are skipped and short rows are
 * padded with empty cells.
 */
@Log4j2
public final class CsvTableLoader {
    private static final char BOM = '\uFEFF';

    private final CsvMapper mapper;

    public CsvTableLoader() {
        this.mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    public RawTable load(NetworkTable kind, Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            RawTable table = load(kind, reader);
            log.info("Loaded {} {} rows from {}", table.size(), kind.displayName(), path);
            return table;
        }
    }

    public RawTable load(NetworkTable kind, Reader reader) throws IOException {
        List<String[]> records;
        try (MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(reader)) {
            records = it.readAll();
        }
        if (records.isEmpty())
            throw SchemaException.missingColumn(kind.displayName(), kind.columns().get(0));

        int[] positions = resolveColumns(kind, records.get(0));
        List<TableRow> rows = new ArrayList<>(records.size() - 1);
        for (int r = 1; r < records.size(); r++) {
            String[] record = records.get(r);
            List<String> cells = new ArrayList<>(positions.length);
            for (int pos : positions)
                cells.add(pos < record.length && record[pos] != null ? record[pos] : "");
            rows.add(new TableRow(r, cells));
        }
        return new RawTable(kind, rows);
    }

    /**
     * Locates every required column in the header row.
     *
     * @return for each required column, its position in the source records
     */
    private static int[] resolveColumns(NetworkTable kind, String[] header) {
        List<String> canonical = new ArrayList<>(header.length);
        for (int i = 0; i < header.length; i++) {
            String h = header[i] == null ? "" : header[i].strip();
            if (i == 0 && !h.isEmpty() && h.charAt(0) == BOM)
                h = h.substring(1).strip();
            canonical.add(kind.canonicalColumn(h));
        }
        int[] positions = new int[kind.columns().size()];
        for (int c = 0; c < positions.length; c++) {
            String column = kind.columns().get(c);
            int pos = canonical.indexOf(column);
            if (pos < 0) {
                log.error("{} header {} lacks column {}", kind.displayName(), Arrays.toString(header), column);
                throw SchemaException.missingColumn(kind.displayName(), column);
            }
            positions[c] = pos;
        }
        return positions;
    }
}
