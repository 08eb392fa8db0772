package com.tapas.superstore.etl.graph;

public enum ReferentialIntegrity {
    /** Unmatched child rows get null parent features. */
    NULL_JOINABLE,
    /** Unmatched child rows fail the batch. */
    STRICT;

    public static ReferentialIntegrity fromProperty(String value) {
        return ReferentialIntegrity.valueOf(value.trim().replace('-', '_').toUpperCase());
    }
}
