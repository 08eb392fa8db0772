package com.tapas.superstore.etl.schema;

public record TargetDefinition(
        String entity,
        int maxDepth) {
}
