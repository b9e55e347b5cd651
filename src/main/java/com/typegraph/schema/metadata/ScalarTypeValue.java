package com.typegraph.schema.metadata;

import graphql.schema.GraphQLScalarType;
import lombok.NonNull;
import lombok.Value;

/**
 * A built-in GraphQL scalar (Int, Float, String, Boolean, ID).
 */
@Value
public class ScalarTypeValue implements TypeValue {

    @NonNull
    GraphQLScalarType scalar;

    @Override
    public boolean isClassType() {
        return false;
    }

    @Override
    public String getTypeName() {
        return scalar.getName();
    }
}
