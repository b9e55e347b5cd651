package com.typegraph.schema.metadata.builder;

import java.util.Objects;
import java.util.function.Function;

/**
 * Memoizes one kind of metadata per class.
 *
 * Backed by {@link ClassValue}: an entry never keeps its class reachable, even though the cached
 * metadata refers back to the class. A computation that throws stores nothing, so the next
 * lookup for that class runs the computation again.
 */
class ClassMetadataCache<V> {

    private final ClassValue<V> values;

    ClassMetadataCache(Function<Class<?>, V> computation) {
        Objects.requireNonNull(computation, "computation");
        this.values = new ClassValue<>() {
            @Override
            protected V computeValue(Class<?> type) {
                return computation.apply(type);
            }
        };
    }

    V get(Class<?> type) {
        return values.get(Objects.requireNonNull(type, "type"));
    }
}
