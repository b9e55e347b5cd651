package com.typegraph.schema.build;

import com.typegraph.schema.metadata.MetadataCategory;
import com.typegraph.schema.metadata.exception.SchemaMetadataException;

import lombok.NonNull;
import lombok.Value;

/**
 * One class that failed to resolve as one category.
 */
@Value
public class ResolutionError {

    @NonNull
    Class<?> typeClass;

    @NonNull
    MetadataCategory category;

    @NonNull
    SchemaMetadataException cause;

    public String getTypeName() {
        return typeClass.getName();
    }

    public String getMessage() {
        return cause.getMessage();
    }
}
