package com.typegraph.schema.metadata.exception;

/**
 * A query method parameter has no parameter annotation, or more than one.
 */
public class InvalidParameterDeclarationException extends SchemaMetadataException {

    private static final long serialVersionUID = 1L;

    private final String declarationName;

    public InvalidParameterDeclarationException(String declarationName, String detail) {
        super("Invalid parameter '" + declarationName + "': " + detail);
        this.declarationName = declarationName;
    }

    public String getDeclarationName() {
        return declarationName;
    }
}
