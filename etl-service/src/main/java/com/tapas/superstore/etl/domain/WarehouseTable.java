package com.tapas.superstore.etl.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A finished table ready to be appended to the warehouse.
 */
public record WarehouseTable(
        String name,
        List<TableColumn> columns,
        List<Map<String, Object>> rows) {

    public WarehouseTable {
        columns = List.copyOf(columns);
        rows = rows.stream()
                .map(Collections::unmodifiableMap)
                .toList();
    }

    static WarehouseTable withoutInternalColumns(String name,
                                                 List<TableColumn> columns,
                                                 List<Map<String, Object>> rows) {
        List<TableColumn> persisted = columns.stream()
                .filter(c -> !c.internal())
                .toList();
        List<Map<String, Object>> projected = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (TableColumn column : persisted) {
                copy.put(column.name(), row.get(column.name()));
            }
            projected.add(copy);
        }
        return new WarehouseTable(name, persisted, projected);
    }

    public List<String> columnNames() {
        return columns.stream()
                .map(TableColumn::name)
                .toList();
    }

    public boolean hasInternalColumns() {
        return columns.stream().anyMatch(TableColumn::internal);
    }
}
