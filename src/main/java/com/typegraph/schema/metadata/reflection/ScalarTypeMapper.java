package com.typegraph.schema.metadata.reflection;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import graphql.Scalars;
import graphql.schema.GraphQLScalarType;

/**
 * Maps Java classes to the built-in GraphQL scalars.
 *
 * Pure lookup: no fallback for unmapped classes.
 */
public class ScalarTypeMapper {

    private static final Map<Class<?>, GraphQLScalarType> SCALARS = Map.ofEntries(
            Map.entry(String.class, Scalars.GraphQLString),
            Map.entry(char.class, Scalars.GraphQLString),
            Map.entry(Character.class, Scalars.GraphQLString),
            Map.entry(int.class, Scalars.GraphQLInt),
            Map.entry(Integer.class, Scalars.GraphQLInt),
            Map.entry(short.class, Scalars.GraphQLInt),
            Map.entry(Short.class, Scalars.GraphQLInt),
            Map.entry(byte.class, Scalars.GraphQLInt),
            Map.entry(Byte.class, Scalars.GraphQLInt),
            Map.entry(float.class, Scalars.GraphQLFloat),
            Map.entry(Float.class, Scalars.GraphQLFloat),
            Map.entry(double.class, Scalars.GraphQLFloat),
            Map.entry(Double.class, Scalars.GraphQLFloat),
            Map.entry(boolean.class, Scalars.GraphQLBoolean),
            Map.entry(Boolean.class, Scalars.GraphQLBoolean),
            Map.entry(UUID.class, Scalars.GraphQLID)
    );

    public Optional<GraphQLScalarType> findScalar(Class<?> javaType) {
        return Optional.ofNullable(SCALARS.get(javaType));
    }

    /**
     * Whether the class belongs to the JDK, so it can never be a declared schema class.
     */
    public boolean isPlatformType(Class<?> javaType) {
        if (javaType.isPrimitive()) {
            return true;
        }
        String name = javaType.getName();
        return name.startsWith("java.") || name.startsWith("javax.");
    }
}
