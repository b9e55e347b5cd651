package com.typegraph.schema.metadata.exception;

import com.typegraph.schema.metadata.raw.RawQueryMetadata;

/**
 * A query method mixes {@code @Arg} and {@code @Args} parameters.
 */
public class SimultaneousArgsUsageException extends SchemaMetadataException {

    private static final long serialVersionUID = 1L;

    private final transient RawQueryMetadata query;

    public SimultaneousArgsUsageException(RawQueryMetadata query) {
        super("Method '" + query.getDeclarationName() + "' declares both @Arg and @Args parameters. "
                + "Use either single @Arg parameters or one @Args parameter.");
        this.query = query;
    }

    public RawQueryMetadata getQuery() {
        return query;
    }
}
