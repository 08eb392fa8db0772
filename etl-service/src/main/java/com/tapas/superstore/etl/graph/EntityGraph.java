package com.tapas.superstore.etl.graph;

import com.tapas.superstore.etl.schema.RelationshipDefinition;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class EntityGraph {

    private final Map<String, EntityNode> nodes;
    private final List<RelationshipDefinition> relationships;

    EntityGraph(Map<String, EntityNode> nodes, List<RelationshipDefinition> relationships) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.relationships = List.copyOf(relationships);
    }

    public EntityNode node(String name) {
        EntityNode node = nodes.get(name);
        if (node == null) {
            throw new IllegalArgumentException("Entity " + name + " is not part of the graph");
        }
        return node;
    }

    public Collection<EntityNode> nodes() {
        return nodes.values();
    }

    public List<RelationshipDefinition> relationships() {
        return relationships;
    }

    /**
     * Edges pointing into {@code child}, in declaration order.
     */
    public List<RelationshipDefinition> parentsOf(String child) {
        return relationships.stream()
                .filter(r -> r.child().equals(child))
                .toList();
    }
}
