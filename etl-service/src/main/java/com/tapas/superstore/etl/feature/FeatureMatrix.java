package com.tapas.superstore.etl.feature;

import com.tapas.superstore.etl.domain.TableColumn;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One feature vector per target row, keyed by the target's index value and kept
 * in target row order.
 */
public final class FeatureMatrix {

    private final String targetEntity;
    private final List<TableColumn> columns;
    private final Map<Object, Map<String, Object>> rows;

    public FeatureMatrix(String targetEntity, List<TableColumn> columns, Map<Object, Map<String, Object>> rows) {
        this.targetEntity = targetEntity;
        this.columns = List.copyOf(columns);
        var copy = new LinkedHashMap<Object, Map<String, Object>>();
        rows.forEach((key, row) -> copy.put(key, Collections.unmodifiableMap(row)));
        this.rows = Collections.unmodifiableMap(copy);
    }

    public String targetEntity() {
        return targetEntity;
    }

    public List<TableColumn> columns() {
        return columns;
    }

    public List<String> columnNames() {
        return columns.stream()
                .map(TableColumn::name)
                .toList();
    }

    public Optional<TableColumn> column(String name) {
        return columns.stream()
                .filter(c -> c.name().equals(name))
                .findFirst();
    }

    public Map<Object, Map<String, Object>> rows() {
        return rows;
    }

    /**
     * @return the feature vector for {@code key}, or {@code null} when the
     * matrix has no row for it
     */
    public Map<String, Object> row(Object key) {
        return rows.get(key);
    }

    public int size() {
        return rows.size();
    }
}
