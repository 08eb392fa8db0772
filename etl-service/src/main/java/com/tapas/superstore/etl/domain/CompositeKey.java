package com.tapas.superstore.etl.domain;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Structured multi-part key. Equality is component-wise, so two keys can never
 * collide the way concatenated strings do.
 */
public record CompositeKey(List<Object> parts) {

    public CompositeKey {
        parts = List.copyOf(parts);
    }

    public static CompositeKey of(Object... parts) {
        return new CompositeKey(List.of(parts));
    }

    @Override
    public String toString() {
        return parts.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
