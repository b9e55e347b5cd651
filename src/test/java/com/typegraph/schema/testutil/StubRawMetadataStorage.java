package com.typegraph.schema.testutil;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.typegraph.schema.metadata.raw.RawFieldMetadata;
import com.typegraph.schema.metadata.raw.RawInputTypeMetadata;
import com.typegraph.schema.metadata.raw.RawObjectTypeMetadata;
import com.typegraph.schema.metadata.raw.RawParameterMetadata;
import com.typegraph.schema.metadata.raw.RawQueryMetadata;
import com.typegraph.schema.metadata.raw.RawResolverMetadata;
import com.typegraph.schema.metadata.storage.RawMetadataStorage;

/**
 * Hand-filled storage that counts every lookup. Unlike the in-memory storage it can hold
 * an explicitly empty member list.
 */
public class StubRawMetadataStorage implements RawMetadataStorage {

    private final Map<Class<?>, RawObjectTypeMetadata> objectTypes = new HashMap<>();
    private final Map<Class<?>, RawInputTypeMetadata> inputTypes = new HashMap<>();
    private final Map<Class<?>, RawResolverMetadata> resolvers = new HashMap<>();
    private final Map<Class<?>, List<RawFieldMetadata>> fields = new HashMap<>();
    private final Map<Class<?>, List<RawQueryMetadata>> queries = new HashMap<>();
    private final Map<String, List<RawParameterMetadata>> parameters = new HashMap<>();

    private final Map<String, Integer> callCounts = new HashMap<>();

    public StubRawMetadataStorage putObjectType(RawObjectTypeMetadata metadata) {
        objectTypes.put(metadata.getTarget(), metadata);
        return this;
    }

    public StubRawMetadataStorage putInputType(RawInputTypeMetadata metadata) {
        inputTypes.put(metadata.getTarget(), metadata);
        return this;
    }

    public StubRawMetadataStorage putResolver(RawResolverMetadata metadata) {
        resolvers.put(metadata.getTarget(), metadata);
        return this;
    }

    public StubRawMetadataStorage putFields(Class<?> typeClass, List<RawFieldMetadata> metadata) {
        fields.put(typeClass, metadata);
        return this;
    }

    public StubRawMetadataStorage putQueries(Class<?> resolverClass, List<RawQueryMetadata> metadata) {
        queries.put(resolverClass, metadata);
        return this;
    }

    public StubRawMetadataStorage putParameters(Class<?> resolverClass, String methodName,
                                                List<RawParameterMetadata> metadata) {
        parameters.put(key(resolverClass, methodName), metadata);
        return this;
    }

    public int callCount(String lookup) {
        return callCounts.getOrDefault(lookup, 0);
    }

    public int totalCalls() {
        return callCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    @Override
    public Optional<RawObjectTypeMetadata> findObjectTypeMetadata(Class<?> typeClass) {
        count("findObjectTypeMetadata");
        return Optional.ofNullable(objectTypes.get(typeClass));
    }

    @Override
    public Optional<RawInputTypeMetadata> findInputTypeMetadata(Class<?> typeClass) {
        count("findInputTypeMetadata");
        return Optional.ofNullable(inputTypes.get(typeClass));
    }

    @Override
    public Optional<RawResolverMetadata> findResolverMetadata(Class<?> resolverClass) {
        count("findResolverMetadata");
        return Optional.ofNullable(resolvers.get(resolverClass));
    }

    @Override
    public Optional<List<RawFieldMetadata>> findFieldsMetadata(Class<?> typeClass) {
        count("findFieldsMetadata");
        return Optional.ofNullable(fields.get(typeClass));
    }

    @Override
    public Optional<List<RawQueryMetadata>> findQueriesMetadata(Class<?> resolverClass) {
        count("findQueriesMetadata");
        return Optional.ofNullable(queries.get(resolverClass));
    }

    @Override
    public Optional<List<RawParameterMetadata>> findParametersMetadata(Class<?> resolverClass, String methodName) {
        count("findParametersMetadata");
        return Optional.ofNullable(parameters.get(key(resolverClass, methodName)));
    }

    private void count(String lookup) {
        callCounts.merge(lookup, 1, Integer::sum);
    }

    private static String key(Class<?> resolverClass, String methodName) {
        return resolverClass.getName() + "#" + methodName;
    }
}
