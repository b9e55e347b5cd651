package com.typegraph.schema.metadata.raw;

import com.typegraph.schema.metadata.ParamKind;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Unvalidated declaration of one resolver method parameter.
 */
@Value
@Builder(toBuilder = true)
public class RawParameterMetadata {

    @NonNull
    Class<?> target;

    /**
     * Name of the declaring method.
     */
    @NonNull
    String propertyKey;

    /**
     * Zero-based position in the method signature.
     */
    int index;

    @NonNull
    ParamKind kind;

    /**
     * Argument name; only set for {@link ParamKind#SINGLE_ARG}.
     */
    String name;

    String description;

    @NonNull
    RawTypeOptions typeOptions;

    public String getDeclarationName() {
        return target.getSimpleName() + "." + propertyKey + "#" + index;
    }
}
