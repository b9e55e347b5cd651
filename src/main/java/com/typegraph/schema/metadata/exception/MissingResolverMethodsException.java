package com.typegraph.schema.metadata.exception;

/**
 * A resolver class declares no query methods.
 */
public class MissingResolverMethodsException extends SchemaMetadataException {

    private static final long serialVersionUID = 1L;

    private final Class<?> resolverClass;

    public MissingResolverMethodsException(Class<?> resolverClass) {
        super("Resolver class '" + resolverClass.getName() + "' has no query methods declared. "
                + "Resolvers need at least one @Query method.");
        this.resolverClass = resolverClass;
    }

    public Class<?> getResolverClass() {
        return resolverClass;
    }
}
