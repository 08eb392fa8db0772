package com.tapas.superstore.etl.graph;

import com.tapas.superstore.etl.domain.EntityFrame;

import java.util.Collections;
import java.util.Map;

/**
 * Entity registered in the graph with its rows indexed by primary key.
 */
public record EntityNode(
        EntityFrame frame,
        Map<Object, Map<String, Object>> rowsByKey) {

    public EntityNode {
        rowsByKey = Collections.unmodifiableMap(rowsByKey);
    }

    public String name() {
        return frame.name();
    }

    public String index() {
        return frame.index();
    }

    public Map<String, Object> row(Object key) {
        return key == null ? null : rowsByKey.get(key);
    }
}
