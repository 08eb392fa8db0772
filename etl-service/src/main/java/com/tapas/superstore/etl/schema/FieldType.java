package com.tapas.superstore.etl.schema;

public enum FieldType {
    STRING,
    INTEGER,
    DECIMAL,
    DATE,
    /** Internal composite key. Never persisted. */
    KEY;

    public boolean isNumeric() {
        return this == INTEGER || this == DECIMAL;
    }
}
