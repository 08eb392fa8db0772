package com.tapas.superstore.etl.schema;

public enum DedupStrategy {
    /** First row wins per index value. */
    INDEX,
    /** Only rows equal in every column collapse. */
    FULL_ROW
}
