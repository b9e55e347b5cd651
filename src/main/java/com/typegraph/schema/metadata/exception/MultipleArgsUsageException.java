package com.typegraph.schema.metadata.exception;

import com.typegraph.schema.metadata.raw.RawQueryMetadata;

/**
 * A query method declares more than one {@code @Args} parameter.
 */
public class MultipleArgsUsageException extends SchemaMetadataException {

    private static final long serialVersionUID = 1L;

    private final transient RawQueryMetadata query;

    public MultipleArgsUsageException(RawQueryMetadata query) {
        super("Method '" + query.getDeclarationName() + "' declares more than one @Args parameter. "
                + "Use a single @Args parameter per method.");
        this.query = query;
    }

    public RawQueryMetadata getQuery() {
        return query;
    }
}
