package com.typegraph.schema.metadata;

import java.util.Optional;

import com.typegraph.schema.metadata.raw.RawParameterMetadata;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A resolver method parameter.
 *
 * Argument parameters ({@link ParamKind#SINGLE_ARG}, {@link ParamKind#SPREAD_ARGS}) carry a
 * resolved type; context and info parameters do not.
 */
@Value
@Builder(toBuilder = true)
public class ParameterMetadata {

    @NonNull
    RawParameterMetadata raw;

    TypeMetadata type;

    public Optional<TypeMetadata> getType() {
        return Optional.ofNullable(type);
    }

    public ParamKind getKind() {
        return raw.getKind();
    }
}
