package com.tapas.superstore.etl.repository;

/**
 * Identifier quoting shared by the JDBC repositories. Column names such as
 * {@code Customer ID} contain spaces, so every identifier is quoted.
 */
final class WarehouseNames {

    private WarehouseNames() {
    }

    static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    static String qualified(String dataset, String table) {
        return quote(dataset) + "." + quote(table);
    }
}
