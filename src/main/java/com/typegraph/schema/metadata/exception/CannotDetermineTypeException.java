package com.typegraph.schema.metadata.exception;

/**
 * The declared type of a member cannot be turned into a schema type.
 */
public class CannotDetermineTypeException extends SchemaMetadataException {

    private static final long serialVersionUID = 1L;

    private final String declarationName;

    public CannotDetermineTypeException(String declarationName, String reason) {
        super("Cannot determine the schema type of '" + declarationName + "': " + reason
                + ". Provide an explicit type in the annotation.");
        this.declarationName = declarationName;
    }

    public String getDeclarationName() {
        return declarationName;
    }
}
