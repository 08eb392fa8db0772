package com.tapas.superstore.etl.domain;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered rows of one entity together with their column layout and index column.
 * Rows are immutable maps keyed by column name; values may be null.
 */
public final class EntityFrame {

    private final String name;
    private final String index;
    private final List<TableColumn> columns;
    private final List<Map<String, Object>> rows;

    public EntityFrame(String name, String index, List<TableColumn> columns, List<Map<String, Object>> rows) {
        this.name = name;
        this.index = index;
        this.columns = List.copyOf(columns);
        this.rows = rows.stream()
                .map(Collections::unmodifiableMap)
                .toList();
        if (column(index).isEmpty()) {
            throw new IllegalArgumentException("Index " + index + " is not a column of " + name);
        }
    }

    public String name() {
        return name;
    }

    public String index() {
        return index;
    }

    public List<TableColumn> columns() {
        return columns;
    }

    public List<Map<String, Object>> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public Optional<TableColumn> column(String columnName) {
        return columns.stream()
                .filter(c -> c.name().equals(columnName))
                .findFirst();
    }

    public boolean hasColumn(String columnName) {
        return column(columnName).isPresent();
    }

    /**
     * Persisted shape of this frame: internal columns are dropped.
     */
    public WarehouseTable toWarehouseTable() {
        return WarehouseTable.withoutInternalColumns(name, columns, rows);
    }

    @Override
    public String toString() {
        return name + "[" + rows.size() + " rows]";
    }
}
