package com.regnet.engine;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A table is missing a required column, or a column holds values outside its
 * enumeration.
 */
public final class SchemaException extends NetworkValidationException {
    private static final long serialVersionUID = 1L;

    private final String table;
    private final String column;
    private final Set<String> offendingValues;

    public SchemaException(String table, String column, Set<String> offendingValues, String message) {
        super(message);
        this.table = table;
        this.column = column;
        this.offendingValues = Collections.unmodifiableSet(new LinkedHashSet<>(offendingValues));
    }

    public static SchemaException missingColumn(String table, String column) {
        return new SchemaException(table, column, Set.of(),
                table + " table missing column: " + column);
    }

    public static SchemaException unsupportedValues(String table, String column, Set<String> values) {
        return new SchemaException(table, column, values,
                "Unsupported " + table + " " + column + " values: " + values);
    }

    public String table() {
        return table;
    }

    public String column() {
        return column;
    }

    public Set<String> offendingValues() {
        return offendingValues;
    }
}
