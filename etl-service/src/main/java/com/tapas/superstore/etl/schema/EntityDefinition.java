package com.tapas.superstore.etl.schema;

import java.util.List;

/**
 * Projection of the flat record onto one entity.
 * When {@code compositeKey} is non-empty the index is a synthetic column built
 * from those fields and is never part of the persisted table.
 */
public record EntityDefinition(
        String name,
        String index,
        List<String> columns,
        DedupStrategy dedup,
        List<String> compositeKey) {

    public EntityDefinition {
        columns = columns == null ? List.of() : List.copyOf(columns);
        compositeKey = compositeKey == null ? List.of() : List.copyOf(compositeKey);
        dedup = dedup == null ? DedupStrategy.INDEX : dedup;
    }

    public boolean hasSyntheticIndex() {
        return !compositeKey.isEmpty();
    }
}
