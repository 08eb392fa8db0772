package com.tapas.superstore.etl.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entity frames produced from one input batch, in schema order.
 */
public record NormalizedBatch(Map<String, EntityFrame> frames) {

    public NormalizedBatch {
        frames = Collections.unmodifiableMap(new LinkedHashMap<>(frames));
    }

    public EntityFrame frame(String entityName) {
        EntityFrame frame = frames.get(entityName);
        if (frame == null) {
            throw new IllegalArgumentException("No frame for entity " + entityName);
        }
        return frame;
    }
}
