package com.typegraph.schema.metadata.reflection;

import com.typegraph.schema.metadata.TypeMetadata;
import com.typegraph.schema.metadata.raw.RawFieldMetadata;
import com.typegraph.schema.metadata.raw.RawParameterMetadata;
import com.typegraph.schema.metadata.raw.RawQueryMetadata;

/**
 * Turns a raw declared type plus the build-wide nullability default into a normalized type.
 *
 * Implementations throw a {@code SchemaMetadataException} for a type expression they cannot
 * interpret; callers let it propagate.
 */
public interface TypeReflection {

    TypeMetadata resolveFieldType(RawFieldMetadata field, boolean nullableByDefault);

    TypeMetadata resolveQueryReturnType(RawQueryMetadata query, boolean nullableByDefault);

    TypeMetadata resolveParameterType(RawParameterMetadata parameter, boolean nullableByDefault);
}
