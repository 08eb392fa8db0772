package com.tapas.superstore.etl.graph;

import com.tapas.superstore.etl.domain.EntityFrame;
import com.tapas.superstore.etl.domain.NormalizedBatch;
import com.tapas.superstore.etl.exception.DanglingReferenceException;
import com.tapas.superstore.etl.schema.RelationshipDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registers normalized frames as graph nodes and wires the declared
 * one-to-many relationships between them.
 */
public class EntityGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(EntityGraphBuilder.class);

    private final ReferentialIntegrity referentialIntegrity;

    public EntityGraphBuilder(ReferentialIntegrity referentialIntegrity) {
        this.referentialIntegrity = referentialIntegrity;
    }

    public EntityGraph build(NormalizedBatch batch, List<RelationshipDefinition> relationships) {
        var nodes = new LinkedHashMap<String, EntityNode>();
        for (EntityFrame frame : batch.frames().values()) {
            nodes.put(frame.name(), index(frame));
        }

        for (RelationshipDefinition relationship : relationships) {
            EntityNode parent = nodes.get(relationship.parent());
            EntityNode child = nodes.get(relationship.child());
            if (parent == null || child == null) {
                throw new IllegalArgumentException("Relationship " + relationship + " references an unknown entity");
            }
            if (!parent.index().equals(relationship.parentKey())) {
                throw new IllegalArgumentException(
                        "Relationship " + relationship + " must use the primary key of " + parent.name());
            }
            if (!child.frame().hasColumn(relationship.childKey())) {
                throw new IllegalArgumentException(
                        "Relationship " + relationship + " uses missing child column " + relationship.childKey());
            }
            checkReferences(parent, child, relationship);
        }
        return new EntityGraph(nodes, relationships);
    }

    private static EntityNode index(EntityFrame frame) {
        var rowsByKey = new LinkedHashMap<Object, Map<String, Object>>();
        int repeated = 0;
        for (Map<String, Object> row : frame.rows()) {
            if (rowsByKey.putIfAbsent(row.get(frame.index()), row) != null) {
                repeated++;
            }
        }
        if (repeated > 0) {
            // first row per key is the one related rows are joined to
            log.warn("{} {} row(s) repeat an existing {} value; joins use the first occurrence",
                    repeated, frame.name(), frame.index());
        }
        return new EntityNode(frame, rowsByKey);
    }

    private void checkReferences(EntityNode parent, EntityNode child, RelationshipDefinition relationship) {
        Set<Object> missing = new LinkedHashSet<>();
        for (Map<String, Object> row : child.frame().rows()) {
            Object key = row.get(relationship.childKey());
            if (key != null && parent.row(key) == null) {
                missing.add(key);
            }
        }
        if (missing.isEmpty()) {
            return;
        }
        if (referentialIntegrity == ReferentialIntegrity.STRICT) {
            throw new DanglingReferenceException(parent.name(), child.name(), missing);
        }
        log.warn("{} {} key(s) referenced by {} have no parent row; their {} features will be null",
                missing.size(), parent.name(), child.name(), parent.name());
    }
}
