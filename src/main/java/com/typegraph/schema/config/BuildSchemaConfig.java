package com.typegraph.schema.config;

import lombok.Builder;
import lombok.Value;

/**
 * Schema-wide settings for one build pass.
 *
 * Immutable: a metadata builder keeps the instance it was created with for its whole lifetime,
 * so cached metadata always matches the configuration.
 */
@Value
@Builder(toBuilder = true)
public class BuildSchemaConfig {

    /**
     * Nullability of fields, queries and arguments that declare no explicit override.
     */
    @Builder.Default
    boolean nullableByDefault = false;

    public static BuildSchemaConfig defaults() {
        return BuildSchemaConfig.builder().build();
    }
}
