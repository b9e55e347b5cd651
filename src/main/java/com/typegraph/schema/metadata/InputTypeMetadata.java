package com.typegraph.schema.metadata;

import java.util.List;

import com.typegraph.schema.metadata.raw.RawInputTypeMetadata;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Resolved input type: its declaration plus at least one resolved field.
 */
@Value
@Builder(toBuilder = true)
public class InputTypeMetadata {

    @NonNull
    RawInputTypeMetadata raw;

    @NonNull
    @Singular
    List<FieldMetadata> fields;

    public Class<?> getTarget() {
        return raw.getTarget();
    }

    public String getSchemaName() {
        return raw.getSchemaName();
    }
}
