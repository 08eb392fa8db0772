package com.tapas.superstore.etl.schema;

/**
 * One field of the flat input record.
 */
public record FieldDefinition(
        String name,
        FieldType type) {
}
