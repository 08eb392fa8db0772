package com.tapas.superstore.etl.feature;

import com.tapas.superstore.etl.domain.TableColumn;
import com.tapas.superstore.etl.graph.EntityGraph;
import com.tapas.superstore.etl.graph.EntityNode;
import com.tapas.superstore.etl.schema.FieldType;
import com.tapas.superstore.etl.schema.RelationshipDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives per-row features for a target entity from the ancestors that own its
 * rows.
 * <p>
 * Ancestors are found by walking relationships from child to parent, up to
 * {@code maxDepth} hops. For each ancestor the target rows are grouped by the
 * ancestor key they resolve to, aggregated, and the ancestor-level values are
 * broadcast back onto every target row of the group.
 */
public class FeatureDerivationEngine {

    private static final Logger log = LoggerFactory.getLogger(FeatureDerivationEngine.class);

    private final List<AggregationPrimitive> aggregations;
    private final List<DatePartPrimitive> dateParts;
    private final boolean parallel;

    public FeatureDerivationEngine() {
        this(List.of(AggregationPrimitive.values()), List.of(DatePartPrimitive.values()), false);
    }

    public FeatureDerivationEngine(List<AggregationPrimitive> aggregations,
                                   List<DatePartPrimitive> dateParts,
                                   boolean parallel) {
        this.aggregations = List.copyOf(aggregations);
        this.dateParts = List.copyOf(dateParts);
        this.parallel = parallel;
    }

    public FeatureMatrix derive(EntityGraph graph, String targetEntity, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Max depth must be at least 1, was " + maxDepth);
        }
        EntityNode target = graph.node(targetEntity);
        List<AncestorPath> paths = ancestorPaths(graph, targetEntity, maxDepth);

        // groups are independent; toList keeps path order whether or not they run in parallel
        List<AncestorFeatures> ancestors = (parallel ? paths.parallelStream() : paths.stream())
                .map(path -> aggregateAncestor(graph, targetEntity, path))
                .toList();

        var features = new LinkedHashMap<Object, Map<String, Object>>();
        for (Map<String, Object> row : target.frame().rows()) {
            if (features.put(row.get(target.index()), new LinkedHashMap<>()) != null) {
                throw new IllegalArgumentException(
                        "Index " + target.index() + " of " + targetEntity + " is not unique");
            }
        }

        var columns = new ArrayList<TableColumn>();
        for (AncestorFeatures ancestor : ancestors) {
            columns.addAll(ancestor.columns());
            for (Map<String, Object> row : target.frame().rows()) {
                Map<String, Object> values = ancestor.values().get(ancestor.path().resolve(graph, row));
                Map<String, Object> vector = features.get(row.get(target.index()));
                for (TableColumn column : ancestor.columns()) {
                    vector.put(column.name(), values == null ? null : values.get(column.name()));
                }
            }
        }

        log.debug("Derived {} feature(s) for {} {} row(s) from {} ancestor path(s)",
                columns.size(), target.frame().size(), targetEntity, paths.size());
        return new FeatureMatrix(targetEntity, columns, features);
    }

    /**
     * Ancestor paths reachable from {@code targetEntity}, breadth first, each
     * level in relationship declaration order.
     */
    public List<AncestorPath> ancestorPaths(EntityGraph graph, String targetEntity, int maxDepth) {
        var result = new ArrayList<AncestorPath>();
        var queue = new ArrayDeque<AncestorPath>();
        for (RelationshipDefinition edge : graph.parentsOf(targetEntity)) {
            queue.add(new AncestorPath(List.of(edge)));
        }
        while (!queue.isEmpty()) {
            AncestorPath path = queue.poll();
            result.add(path);
            if (path.depth() >= maxDepth) {
                continue;
            }
            for (RelationshipDefinition edge : graph.parentsOf(path.ancestor())) {
                if (!edge.parent().equals(targetEntity) && !path.visits(edge.parent())) {
                    queue.add(path.extend(edge));
                }
            }
        }
        return result;
    }

    /**
     * Aggregates for every row of the ancestor at the end of {@code path},
     * including rows that own no target rows.
     */
    public AncestorFeatures aggregateAncestor(EntityGraph graph, String targetEntity, AncestorPath path) {
        EntityNode target = graph.node(targetEntity);
        EntityNode ancestor = graph.node(path.ancestor());

        var groups = new HashMap<Object, List<Map<String, Object>>>();
        for (Map<String, Object> row : target.frame().rows()) {
            Object key = path.resolve(graph, row);
            if (key != null) {
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
            }
        }

        List<TableColumn> numericAttributes = numericAttributes(graph, target);
        List<TableColumn> dateAttributes = ancestor.frame().columns().stream()
                .filter(c -> !c.internal() && c.type() == FieldType.DATE)
                .toList();

        var columns = new ArrayList<TableColumn>();
        for (AggregationPrimitive primitive : aggregations) {
            if (!primitive.needsAttribute()) {
                columns.add(TableColumn.of(
                        path.label() + "." + primitive + "(" + targetEntity + ")",
                        primitive.resultType(null)));
                continue;
            }
            for (TableColumn attribute : numericAttributes) {
                columns.add(TableColumn.of(
                        path.label() + "." + primitive + "(" + targetEntity + "." + attribute.name() + ")",
                        primitive.resultType(attribute.type())));
            }
        }
        for (DatePartPrimitive primitive : dateParts) {
            for (TableColumn attribute : dateAttributes) {
                columns.add(TableColumn.of(
                        path.label() + "." + primitive + "(" + attribute.name() + ")",
                        FieldType.INTEGER));
            }
        }

        var values = new LinkedHashMap<Object, Map<String, Object>>();
        for (Map.Entry<Object, Map<String, Object>> entry : ancestor.rowsByKey().entrySet()) {
            List<Map<String, Object>> descendants = groups.getOrDefault(entry.getKey(), List.of());
            var vector = new LinkedHashMap<String, Object>();
            int column = 0;
            for (AggregationPrimitive primitive : aggregations) {
                if (!primitive.needsAttribute()) {
                    vector.put(columns.get(column++).name(), primitive.apply(descendants, null));
                    continue;
                }
                for (TableColumn attribute : numericAttributes) {
                    List<Object> attributeValues = new ArrayList<>(descendants.size());
                    for (Map<String, Object> descendant : descendants) {
                        attributeValues.add(descendant.get(attribute.name()));
                    }
                    vector.put(columns.get(column++).name(), primitive.apply(attributeValues, attribute.type()));
                }
            }
            for (DatePartPrimitive primitive : dateParts) {
                for (TableColumn attribute : dateAttributes) {
                    Object date = entry.getValue().get(attribute.name());
                    vector.put(columns.get(column++).name(),
                            date instanceof LocalDate localDate ? primitive.apply(localDate) : null);
                }
            }
            values.put(entry.getKey(), vector);
        }
        return new AncestorFeatures(path, columns, values);
    }

    /**
     * Numeric target columns that are neither the index nor a foreign key.
     */
    private static List<TableColumn> numericAttributes(EntityGraph graph, EntityNode target) {
        Set<String> foreignKeys = graph.parentsOf(target.name()).stream()
                .map(RelationshipDefinition::childKey)
                .collect(Collectors.toSet());
        return target.frame().columns().stream()
                .filter(c -> !c.internal() && c.type().isNumeric())
                .filter(c -> !c.name().equals(target.index()) && !foreignKeys.contains(c.name()))
                .toList();
    }

    /**
     * Chain of relationships from the target up to one ancestor; the first edge's
     * child is the target.
     */
    public record AncestorPath(List<RelationshipDefinition> edges) {

        public AncestorPath {
            edges = List.copyOf(edges);
        }

        public String ancestor() {
            return edges.get(edges.size() - 1).parent();
        }

        public int depth() {
            return edges.size();
        }

        /** Dotted ancestor names, nearest first, e.g. {@code Customers.Regions}. */
        public String label() {
            return edges.stream()
                    .map(RelationshipDefinition::parent)
                    .collect(Collectors.joining("."));
        }

        boolean visits(String entity) {
            return edges.stream().anyMatch(e -> e.parent().equals(entity) || e.child().equals(entity));
        }

        AncestorPath extend(RelationshipDefinition edge) {
            var extended = new ArrayList<>(edges);
            extended.add(edge);
            return new AncestorPath(extended);
        }

        /**
         * Follows the foreign keys of {@code targetRow} up to the ancestor.
         *
         * @return the ancestor's key, or {@code null} when any link is missing
         */
        public Object resolve(EntityGraph graph, Map<String, Object> targetRow) {
            Object key = targetRow.get(edges.get(0).childKey());
            for (int i = 0; i < edges.size(); i++) {
                Map<String, Object> parentRow = graph.node(edges.get(i).parent()).row(key);
                if (parentRow == null) {
                    return null;
                }
                if (i == edges.size() - 1) {
                    return key;
                }
                key = parentRow.get(edges.get(i + 1).childKey());
            }
            return key;
        }
    }

    /**
     * Aggregates of one ancestor, keyed by the ancestor's primary key.
     */
    public record AncestorFeatures(
            AncestorPath path,
            List<TableColumn> columns,
            Map<Object, Map<String, Object>> values) {
    }
}
