package com.tapas.superstore.etl.schema;

import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Field list, entity projections, relationships and feature selection of the
 * warehouse load. Shared by the normalizer, the graph builder and the selector
 * so the three always agree.
 */
public record EtlSchema(
        String name,
        List<String> dateFormats,
        List<FieldDefinition> fields,
        List<EntityDefinition> entities,
        List<RelationshipDefinition> relationships,
        TargetDefinition target,
        List<FeatureSelection> features) {

    public EtlSchema {
        dateFormats = dateFormats == null ? List.of() : List.copyOf(dateFormats);
        fields = fields == null ? List.of() : List.copyOf(fields);
        entities = entities == null ? List.of() : List.copyOf(entities);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        features = features == null ? List.of() : List.copyOf(features);
    }

    public FieldDefinition field(String fieldName) {
        return fields.stream()
                .filter(f -> f.name().equals(fieldName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown field: " + fieldName));
    }

    public EntityDefinition entity(String entityName) {
        return entities.stream()
                .filter(e -> e.name().equals(entityName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity: " + entityName));
    }

    /**
     * Fields that identify rows: entity indexes, composite key parts and
     * relationship keys. These must never be blank.
     */
    public Set<String> keyFields() {
        Set<String> keys = new HashSet<>();
        for (EntityDefinition entity : entities) {
            if (entity.hasSyntheticIndex()) {
                keys.addAll(entity.compositeKey());
            } else {
                keys.add(entity.index());
            }
        }
        for (RelationshipDefinition relationship : relationships) {
            keys.add(relationship.parentKey());
            keys.add(relationship.childKey());
        }
        return keys;
    }

    /**
     * Strict formatters: a day that does not exist in its month fails to parse.
     * Patterns therefore use {@code uuuu}, not {@code yyyy}.
     */
    public List<DateTimeFormatter> dateFormatters() {
        return dateFormats.stream()
                .map(pattern -> DateTimeFormatter.ofPattern(pattern, Locale.ROOT)
                        .withResolverStyle(ResolverStyle.STRICT))
                .toList();
    }

    /**
     * Checks the schema for internal consistency.
     *
     * @throws IllegalStateException describing the first problem found
     */
    public EtlSchema validate() {
        if (fields.isEmpty()) {
            throw new IllegalStateException("Schema " + name + " declares no fields");
        }
        if (dateFormats.isEmpty() && fields.stream().anyMatch(f -> f.type() == FieldType.DATE)) {
            throw new IllegalStateException("Schema " + name + " has DATE fields but no date formats");
        }
        Set<String> fieldNames = new HashSet<>();
        for (FieldDefinition field : fields) {
            if (field.type() == null || field.type() == FieldType.KEY) {
                throw new IllegalStateException("Field " + field.name() + " has no valid type");
            }
            if (!fieldNames.add(field.name())) {
                throw new IllegalStateException("Duplicate field " + field.name());
            }
        }

        Map<String, EntityDefinition> byName = new LinkedHashMap<>();
        for (EntityDefinition entity : entities) {
            if (byName.put(entity.name(), entity) != null) {
                throw new IllegalStateException("Duplicate entity " + entity.name());
            }
            for (String column : entity.columns()) {
                if (!fieldNames.contains(column)) {
                    throw new IllegalStateException(
                            "Entity " + entity.name() + " projects unknown field " + column);
                }
            }
            if (entity.hasSyntheticIndex()) {
                if (entity.columns().contains(entity.index()) || fieldNames.contains(entity.index())) {
                    throw new IllegalStateException(
                            "Synthetic index " + entity.index() + " of " + entity.name() + " clashes with a field");
                }
                if (!entity.columns().containsAll(entity.compositeKey())) {
                    throw new IllegalStateException(
                            "Composite key of " + entity.name() + " must be made of its own columns");
                }
            } else if (!entity.columns().contains(entity.index())) {
                throw new IllegalStateException(
                        "Index " + entity.index() + " is not a column of " + entity.name());
            }
        }

        for (RelationshipDefinition relationship : relationships) {
            EntityDefinition parent = byName.get(relationship.parent());
            EntityDefinition child = byName.get(relationship.child());
            if (parent == null || child == null) {
                throw new IllegalStateException("Relationship " + relationship + " references an unknown entity");
            }
            if (!parent.index().equals(relationship.parentKey())) {
                throw new IllegalStateException(
                        "Relationship " + relationship + " must use the index of " + parent.name());
            }
            if (!child.columns().contains(relationship.childKey())) {
                throw new IllegalStateException(
                        "Relationship " + relationship + " uses unknown child column " + relationship.childKey());
            }
        }

        if (target == null || !byName.containsKey(target.entity())) {
            throw new IllegalStateException("Schema " + name + " has no valid target entity");
        }
        if (target.maxDepth() < 1) {
            throw new IllegalStateException("Max depth must be at least 1, was " + target.maxDepth());
        }

        Set<String> outputs = new HashSet<>();
        for (FeatureSelection feature : features) {
            if (!outputs.add(feature.output())) {
                throw new IllegalStateException("Duplicate feature output name " + feature.output());
            }
            if (byName.get(target.entity()).columns().contains(feature.output())) {
                throw new IllegalStateException(
                        "Feature output " + feature.output() + " clashes with a column of " + target.entity());
            }
        }
        return this;
    }
}
