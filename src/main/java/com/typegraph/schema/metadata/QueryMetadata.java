package com.typegraph.schema.metadata;

import java.util.List;

import com.typegraph.schema.metadata.raw.RawQueryMetadata;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A query handler method with its resolved return type and parameters, in declaration order.
 */
@Value
@Builder(toBuilder = true)
public class QueryMetadata {

    @NonNull
    RawQueryMetadata raw;

    @NonNull
    TypeMetadata type;

    @NonNull
    @Singular
    List<ParameterMetadata> parameters;

    public String getSchemaName() {
        return raw.getSchemaName();
    }

    public String getMethodName() {
        return raw.getPropertyKey();
    }
}
