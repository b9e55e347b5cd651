package com.typegraph.schema.metadata.storage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.typegraph.schema.metadata.exception.DuplicateDeclarationException;
import com.typegraph.schema.metadata.raw.RawFieldMetadata;
import com.typegraph.schema.metadata.raw.RawInputTypeMetadata;
import com.typegraph.schema.metadata.raw.RawObjectTypeMetadata;
import com.typegraph.schema.metadata.raw.RawParameterMetadata;
import com.typegraph.schema.metadata.raw.RawQueryMetadata;
import com.typegraph.schema.metadata.raw.RawResolverMetadata;

/**
 * Append-only, thread-safe raw declaration store.
 *
 * Member declarations keep their registration order. Lookups return snapshots, so callers
 * never observe later registrations through a list they already hold.
 */
public class InMemoryRawMetadataStorage implements RawMetadataStorage {

    private final Map<Class<?>, RawObjectTypeMetadata> objectTypes = new ConcurrentHashMap<>();
    private final Map<Class<?>, RawInputTypeMetadata> inputTypes = new ConcurrentHashMap<>();
    private final Map<Class<?>, RawResolverMetadata> resolvers = new ConcurrentHashMap<>();

    /** Member lists are guarded by {@code this}. */
    private final Map<Class<?>, List<RawFieldMetadata>> fields = new HashMap<>();
    private final Map<Class<?>, List<RawQueryMetadata>> queries = new HashMap<>();
    private final Map<MethodKey, List<RawParameterMetadata>> parameters = new HashMap<>();

    public void collectObjectTypeMetadata(RawObjectTypeMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        if (objectTypes.putIfAbsent(metadata.getTarget(), metadata) != null) {
            throw new DuplicateDeclarationException(metadata.getTarget().getName(),
                    "object type is already registered");
        }
    }

    public void collectInputTypeMetadata(RawInputTypeMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        if (inputTypes.putIfAbsent(metadata.getTarget(), metadata) != null) {
            throw new DuplicateDeclarationException(metadata.getTarget().getName(),
                    "input type is already registered");
        }
    }

    public void collectResolverMetadata(RawResolverMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        if (resolvers.putIfAbsent(metadata.getTarget(), metadata) != null) {
            throw new DuplicateDeclarationException(metadata.getTarget().getName(),
                    "resolver is already registered");
        }
    }

    public synchronized void collectFieldMetadata(RawFieldMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        append(fields, metadata.getTarget(), metadata);
    }

    public synchronized void collectQueryMetadata(RawQueryMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        append(queries, metadata.getTarget(), metadata);
    }

    public synchronized void collectParameterMetadata(RawParameterMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        append(parameters, new MethodKey(metadata.getTarget(), metadata.getPropertyKey()), metadata);
    }

    @Override
    public Optional<RawObjectTypeMetadata> findObjectTypeMetadata(Class<?> typeClass) {
        return Optional.ofNullable(objectTypes.get(typeClass));
    }

    @Override
    public Optional<RawInputTypeMetadata> findInputTypeMetadata(Class<?> typeClass) {
        return Optional.ofNullable(inputTypes.get(typeClass));
    }

    @Override
    public Optional<RawResolverMetadata> findResolverMetadata(Class<?> resolverClass) {
        return Optional.ofNullable(resolvers.get(resolverClass));
    }

    @Override
    public synchronized Optional<List<RawFieldMetadata>> findFieldsMetadata(Class<?> typeClass) {
        return snapshot(fields, typeClass);
    }

    @Override
    public synchronized Optional<List<RawQueryMetadata>> findQueriesMetadata(Class<?> resolverClass) {
        return snapshot(queries, resolverClass);
    }

    @Override
    public synchronized Optional<List<RawParameterMetadata>> findParametersMetadata(Class<?> resolverClass, String methodName) {
        return snapshot(parameters, new MethodKey(resolverClass, methodName));
    }

    private static <K, V> void append(Map<K, List<V>> map, K key, V value) {
        map.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
    }

    private static <K, V> Optional<List<V>> snapshot(Map<K, List<V>> map, K key) {
        List<V> list = map.get(key);
        return list != null ? Optional.of(List.copyOf(list)) : Optional.empty();
    }

    private record MethodKey(Class<?> target, String methodName) {
    }
}
