package com.typegraph.schema.metadata.raw;

import java.lang.reflect.Type;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Declared type of a member as collected from source metadata, before normalization.
 *
 * Every override is optional: {@code null} means "not declared, derive or default it".
 */
@Value
@Builder(toBuilder = true)
public class RawTypeOptions {

    /**
     * Generic type of the Java member (field type, method return type or parameter type).
     */
    @NonNull
    Type reflectedType;

    /**
     * Explicit base type replacing the one derived from {@link #reflectedType}.
     */
    Class<?> explicitType;

    /**
     * Explicit nullability; {@code null} falls back to the build-wide default.
     */
    Boolean nullable;

    /**
     * Explicit list depth; {@code null} uses the depth derived from {@link #reflectedType}.
     */
    Integer listDepth;

    public static RawTypeOptions of(Type reflectedType) {
        return RawTypeOptions.builder().reflectedType(reflectedType).build();
    }
}
