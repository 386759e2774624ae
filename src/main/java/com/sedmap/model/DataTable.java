package com.sedmap.model;

import com.sedmap.exception.ColumnLookupException;
import com.sedmap.exception.ConfigurationException;
import com.sedmap.exception.ShapeMismatchException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Insertion ordered collection of equally long columns. One column may be
 * flagged as the identifier column, holding the flattened pixel positions.
 */
public final class DataTable {

    private final Map<String, Column> columns = new LinkedHashMap<>();
    private final String idColumn;
    private final int rowCount;

    public DataTable(List<Column> columns, String idColumn) {
        if (columns == null || columns.isEmpty()) throw new ConfigurationException("A table needs at least one column");
        int rows = columns.get(0).length();
        for (Column c : columns) {
            if (c.length() != rows) {
                throw new ShapeMismatchException("Column " + c.name + " has " + c.length() + " rows but table has " + rows);
            }
            if (this.columns.put(c.name, c) != null) {
                throw new ConfigurationException("Duplicate column name " + c.name);
            }
        }
        if (idColumn != null && !this.columns.containsKey(idColumn)) {
            throw new ColumnLookupException(idColumn, this.columns.keySet());
        }
        this.idColumn = idColumn;
        this.rowCount = rows;
    }

    public Column column(String name) {
        Column c = columns.get(name);
        if (c == null) throw new ColumnLookupException(name, columns.keySet());
        return c;
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public List<Column> getColumns() {
        return Collections.unmodifiableList(new ArrayList<>(columns.values()));
    }

    public List<String> getColumnNames() {
        return Collections.unmodifiableList(new ArrayList<>(columns.keySet()));
    }

    public String getIdColumn() { return idColumn; }
    public int getRowCount() { return rowCount; }

    public int[] ids() {
        if (idColumn == null) throw new ConfigurationException("Table has no identifier column");
        Column c = columns.get(idColumn);
        int[] out = new int[rowCount];
        for (int i = 0; i < rowCount; i++) out[i] = Column.checkIdentifier(idColumn, i, c.value(i));
        return out;
    }
}
