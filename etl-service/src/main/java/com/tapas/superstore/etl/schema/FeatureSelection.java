package com.tapas.superstore.etl.schema;

public record FeatureSelection(
        String generated,
        String output) {
}
