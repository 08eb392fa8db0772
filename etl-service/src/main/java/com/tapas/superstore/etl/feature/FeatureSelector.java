package com.tapas.superstore.etl.feature;

import com.tapas.superstore.etl.domain.TableColumn;
import com.tapas.superstore.etl.exception.MissingFeatureException;
import com.tapas.superstore.etl.schema.FeatureSelection;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Narrows a derived feature matrix to the configured features and gives them
 * their persisted names.
 */
public class FeatureSelector {

    private final List<FeatureSelection> selections;

    public FeatureSelector(List<FeatureSelection> selections) {
        this.selections = List.copyOf(selections);
    }

    public FeatureMatrix select(FeatureMatrix matrix) {
        var missing = new ArrayList<String>();
        var columns = new ArrayList<TableColumn>();
        for (FeatureSelection selection : selections) {
            Optional<TableColumn> generated = matrix.column(selection.generated());
            if (generated.isEmpty()) {
                missing.add(selection.generated());
            } else {
                columns.add(TableColumn.of(selection.output(), generated.get().type()));
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingFeatureException(missing);
        }

        var rows = new LinkedHashMap<Object, Map<String, Object>>();
        matrix.rows().forEach((key, row) -> {
            var selected = new LinkedHashMap<String, Object>();
            for (FeatureSelection selection : selections) {
                selected.put(selection.output(), row.get(selection.generated()));
            }
            rows.put(key, selected);
        });
        return new FeatureMatrix(matrix.targetEntity(), columns, rows);
    }
}
