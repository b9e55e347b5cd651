package com.typegraph.schema.metadata.raw;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Unvalidated input type declaration.
 */
@Value
@Builder(toBuilder = true)
public class RawInputTypeMetadata {

    @NonNull
    Class<?> target;

    @NonNull
    String schemaName;

    String description;
}
