package com.typegraph.schema.metadata.exception;

/**
 * The same declaration was collected twice.
 */
public class DuplicateDeclarationException extends SchemaMetadataException {

    private static final long serialVersionUID = 1L;

    private final String declarationName;

    public DuplicateDeclarationException(String declarationName, String detail) {
        super("Duplicate declaration '" + declarationName + "': " + detail);
        this.declarationName = declarationName;
    }

    public String getDeclarationName() {
        return declarationName;
    }
}
