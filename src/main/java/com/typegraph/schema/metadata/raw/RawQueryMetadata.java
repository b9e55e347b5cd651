package com.typegraph.schema.metadata.raw;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Unvalidated query handler method declaration.
 */
@Value
@Builder(toBuilder = true)
public class RawQueryMetadata {

    @NonNull
    Class<?> target;

    /**
     * Java method name, also the key of the method's parameter declarations.
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
