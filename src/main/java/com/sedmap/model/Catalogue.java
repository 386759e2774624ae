package com.sedmap.model;

import com.sedmap.exception.ColumnLookupException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A table laid out the way one SED fitting engine reads it. The base name has
 * no extension; the writer adds the engine's one.
 */
public final class Catalogue {

    /** Order of value and error columns. */
    public enum Layout {
        /** value1, error1, value2, error2... (LePhare MEME) */
        INTERLEAVED,
        /** value1, value2..., error1, error2... (LePhare MMEE) */
        GROUPED
    }

    public final String baseName;
    public final Engine engine;
    public final Layout layout;
    private final Map<String, double[]> columns;
    private final List<String> integerColumns;

    public Catalogue(String baseName, Engine engine, Layout layout, Map<String, double[]> columns,
                     List<String> integerColumns) {
        this.baseName = baseName;
        this.engine = engine;
        this.layout = layout;
        this.columns = new LinkedHashMap<>();
        columns.forEach((k, v) -> this.columns.put(k, v.clone()));
        this.integerColumns = new ArrayList<>(integerColumns);
    }

    public List<String> getColumnNames() {
        return Collections.unmodifiableList(new ArrayList<>(columns.keySet()));
    }

    public double[] values(String column) {
        double[] v = columns.get(column);
        if (v == null) throw new ColumnLookupException(column, columns.keySet());
        return v.clone();
    }

    public boolean isInteger(String column) {
        return integerColumns.contains(column);
    }

    public int getRowCount() {
        return columns.isEmpty() ? 0 : columns.values().iterator().next().length;
    }

    /** File name with the engine extension, e.g. {@code galaxy.in}. */
    public String fileName() {
        return baseName + "." + engine.getCatalogueExtension();
    }
}
