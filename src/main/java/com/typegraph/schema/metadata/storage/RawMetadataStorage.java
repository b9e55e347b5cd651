package com.typegraph.schema.metadata.storage;

import java.util.List;
import java.util.Optional;

import com.typegraph.schema.metadata.raw.RawFieldMetadata;
import com.typegraph.schema.metadata.raw.RawInputTypeMetadata;
import com.typegraph.schema.metadata.raw.RawObjectTypeMetadata;
import com.typegraph.schema.metadata.raw.RawParameterMetadata;
import com.typegraph.schema.metadata.raw.RawQueryMetadata;
import com.typegraph.schema.metadata.raw.RawResolverMetadata;

/**
 * Read-only view of the raw declarations collected from annotated classes.
 *
 * All lookups are by class identity. {@link Optional#empty()} means nothing was collected;
 * a present empty list means the category was collected but holds no entries.
 */
public interface RawMetadataStorage {

    Optional<RawObjectTypeMetadata> findObjectTypeMetadata(Class<?> typeClass);

    Optional<RawInputTypeMetadata> findInputTypeMetadata(Class<?> typeClass);

    Optional<RawResolverMetadata> findResolverMetadata(Class<?> resolverClass);

    Optional<List<RawFieldMetadata>> findFieldsMetadata(Class<?> typeClass);

    Optional<List<RawQueryMetadata>> findQueriesMetadata(Class<?> resolverClass);

    Optional<List<RawParameterMetadata>> findParametersMetadata(Class<?> resolverClass, String methodName);
}
