package com.typegraph.schema.metadata.raw;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Unvalidated resolver class declaration.
 */
@Value
@Builder(toBuilder = true)
public class RawResolverMetadata {

    /**
     * The resolver class itself.
     */
    @NonNull
    Class<?> target;

    /**
     * Object type the resolver contributes to, when declared.
     */
    Class<?> objectType;

    String description;
}
