package com.typegraph.schema.metadata.exception;

/**
 * Base type for declaration mistakes found while building schema metadata.
 *
 * These are never transient: the offending declaration has to be fixed at its source.
 */
public abstract class SchemaMetadataException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected SchemaMetadataException(String message) {
        super(message);
    }
}
