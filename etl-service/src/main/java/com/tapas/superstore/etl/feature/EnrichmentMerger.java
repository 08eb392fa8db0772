package com.tapas.superstore.etl.feature;

import com.tapas.superstore.etl.domain.EntityFrame;
import com.tapas.superstore.etl.domain.TableColumn;
import com.tapas.superstore.etl.domain.WarehouseTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Left-joins selected features onto the fact rows by the fact index, then drops
 * the internal columns.
 */
public class EnrichmentMerger {

    public WarehouseTable merge(EntityFrame facts, FeatureMatrix features) {
        List<TableColumn> factColumns = facts.columns().stream()
                .filter(c -> !c.internal())
                .toList();
        for (TableColumn feature : features.columns()) {
            if (facts.hasColumn(feature.name())) {
                throw new IllegalArgumentException(
                        "Feature " + feature.name() + " would overwrite a column of " + facts.name());
            }
        }

        var columns = new ArrayList<TableColumn>(factColumns);
        columns.addAll(features.columns());

        var rows = new ArrayList<Map<String, Object>>(facts.size());
        for (Map<String, Object> fact : facts.rows()) {
            var merged = new LinkedHashMap<String, Object>();
            for (TableColumn column : factColumns) {
                merged.put(column.name(), fact.get(column.name()));
            }
            Map<String, Object> vector = features.row(fact.get(facts.index()));
            for (TableColumn feature : features.columns()) {
                merged.put(feature.name(), vector == null ? null : vector.get(feature.name()));
            }
            rows.add(merged);
        }
        return new WarehouseTable(facts.name(), columns, rows);
    }
}
