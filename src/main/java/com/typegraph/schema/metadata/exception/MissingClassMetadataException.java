package com.typegraph.schema.metadata.exception;

import com.typegraph.schema.metadata.MetadataCategory;

/**
 * No raw declaration of the expected category exists for a class.
 */
public class MissingClassMetadataException extends SchemaMetadataException {

    private static final long serialVersionUID = 1L;

    private final Class<?> typeClass;
    private final MetadataCategory expectedCategory;

    public MissingClassMetadataException(Class<?> typeClass, MetadataCategory expectedCategory) {
        super("Cannot find " + expectedCategory.getLabel() + " metadata for class '"
                + typeClass.getName() + "'. Is it annotated with @" + expectedCategory.getLabel() + "?");
        this.typeClass = typeClass;
        this.expectedCategory = expectedCategory;
    }

    public Class<?> getTypeClass() {
        return typeClass;
    }

    public MetadataCategory getExpectedCategory() {
        return expectedCategory;
    }
}
