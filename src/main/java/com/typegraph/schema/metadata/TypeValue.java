package com.typegraph.schema.metadata;

/**
 * Underlying value of a resolved type.
 *
 * Either a built-in GraphQL scalar ({@link ScalarTypeValue}) or a reference to a
 * declared schema class ({@link ClassTypeValue}).
 */
public interface TypeValue {

    /**
     * Whether this value refers to a declared schema class rather than a scalar.
     */
    boolean isClassType();

    /**
     * Name used when rendering this value in reports and error messages.
     */
    String getTypeName();
}
