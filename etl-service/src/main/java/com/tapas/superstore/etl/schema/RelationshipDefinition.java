package com.tapas.superstore.etl.schema;

/**
 * One-to-many edge: each {@code parent} row owns the {@code child} rows whose
 * {@code childKey} equals its {@code parentKey}.
 */
public record RelationshipDefinition(
        String parent,
        String parentKey,
        String child,
        String childKey) {

    @Override
    public String toString() {
        return parent + "." + parentKey + " -> " + child + "." + childKey;
    }
}
