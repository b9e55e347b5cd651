package com.typegraph.schema.metadata.exception;

import com.typegraph.schema.metadata.raw.RawParameterMetadata;

/**
 * An {@code @Args} parameter is not a single input-shaped class.
 */
public class WrongArgsTypeException extends SchemaMetadataException {

    private static final long serialVersionUID = 1L;

    private final transient RawParameterMetadata parameter;

    public WrongArgsTypeException(RawParameterMetadata parameter) {
        super("Parameter '" + parameter.getDeclarationName() + "' is annotated with @Args "
                + "but its type is a scalar or a list. @Args requires a non-list input class.");
        this.parameter = parameter;
    }

    public RawParameterMetadata getParameter() {
        return parameter;
    }
}
