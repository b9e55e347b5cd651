package com.typegraph.schema.metadata.raw;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Unvalidated field declaration of an object or input type.
 */
@Value
@Builder(toBuilder = true)
public class RawFieldMetadata {

    @NonNull
    Class<?> target;

    /**
     * Java field name.
     */
    @NonNull
    String propertyKey;

    @NonNull
    String schemaName;

    String description;

    @NonNull
    RawTypeOptions typeOptions;

    public String getDeclarationName() {
        return target.getSimpleName() + "." + propertyKey;
    }
}
