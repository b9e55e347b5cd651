package com.typegraph.schema.metadata.exception;

/**
 * An object or input type declares no fields.
 */
public class MissingFieldsException extends SchemaMetadataException {

    private static final long serialVersionUID = 1L;

    private final Class<?> typeClass;

    public MissingFieldsException(Class<?> typeClass) {
        super("Class '" + typeClass.getName() + "' has no fields declared. "
                + "Object and input types need at least one @Field.");
        this.typeClass = typeClass;
    }

    public Class<?> getTypeClass() {
        return typeClass;
    }
}
