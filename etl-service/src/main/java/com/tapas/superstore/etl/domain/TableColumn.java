package com.tapas.superstore.etl.domain;

import com.tapas.superstore.etl.schema.FieldType;

/**
 * Column of an entity frame or a warehouse table. Internal columns exist only
 * while the batch is being processed.
 */
public record TableColumn(
        String name,
        FieldType type,
        boolean internal) {

    public static TableColumn of(String name, FieldType type) {
        return new TableColumn(name, type, false);
    }

    public static TableColumn internal(String name) {
        return new TableColumn(name, FieldType.KEY, true);
    }
}
