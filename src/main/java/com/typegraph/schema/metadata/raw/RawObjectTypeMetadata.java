package com.typegraph.schema.metadata.raw;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Unvalidated object type declaration.
 */
@Value
@Builder(toBuilder = true)
public class RawObjectTypeMetadata {

    @NonNull
    Class<?> target;

    @NonNull
    String schemaName;

    String description;
}
