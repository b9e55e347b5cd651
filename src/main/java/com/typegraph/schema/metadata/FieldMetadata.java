package com.typegraph.schema.metadata;

import com.typegraph.schema.metadata.raw.RawFieldMetadata;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A field of an object or input type together with its resolved type.
 */
@Value
@Builder(toBuilder = true)
public class FieldMetadata {

    @NonNull
    RawFieldMetadata raw;

    @NonNull
    TypeMetadata type;

    public String getSchemaName() {
        return raw.getSchemaName();
    }
}
