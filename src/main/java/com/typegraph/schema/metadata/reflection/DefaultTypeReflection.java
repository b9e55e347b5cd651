package com.typegraph.schema.metadata.reflection;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

import com.typegraph.schema.metadata.ClassTypeValue;
import com.typegraph.schema.metadata.ScalarTypeValue;
import com.typegraph.schema.metadata.TypeMetadata;
import com.typegraph.schema.metadata.TypeModifiers;
import com.typegraph.schema.metadata.TypeValue;
import com.typegraph.schema.metadata.exception.CannotDetermineTypeException;
import com.typegraph.schema.metadata.raw.RawFieldMetadata;
import com.typegraph.schema.metadata.raw.RawParameterMetadata;
import com.typegraph.schema.metadata.raw.RawQueryMetadata;
import com.typegraph.schema.metadata.raw.RawTypeOptions;

import graphql.schema.GraphQLScalarType;

/**
 * Derives schema types from Java generic signatures.
 *
 * One list level is peeled per {@link Iterable} parameterization or array dimension. The base
 * class maps to a GraphQL scalar when it is one, otherwise it must be a declared (non-JDK)
 * class. Explicit overrides from the raw declaration always win over derived values.
 */
public class DefaultTypeReflection implements TypeReflection {

    private final ScalarTypeMapper scalarTypeMapper;

    public DefaultTypeReflection() {
        this(new ScalarTypeMapper());
    }

    public DefaultTypeReflection(ScalarTypeMapper scalarTypeMapper) {
        this.scalarTypeMapper = Objects.requireNonNull(scalarTypeMapper, "scalarTypeMapper");
    }

    @Override
    public TypeMetadata resolveFieldType(RawFieldMetadata field, boolean nullableByDefault) {
        return resolve(field.getDeclarationName(), field.getTypeOptions(), false, nullableByDefault);
    }

    @Override
    public TypeMetadata resolveQueryReturnType(RawQueryMetadata query, boolean nullableByDefault) {
        return resolve(query.getDeclarationName(), query.getTypeOptions(), true, nullableByDefault);
    }

    @Override
    public TypeMetadata resolveParameterType(RawParameterMetadata parameter, boolean nullableByDefault) {
        return resolve(parameter.getDeclarationName(), parameter.getTypeOptions(), false, nullableByDefault);
    }

    private TypeMetadata resolve(String declarationName, RawTypeOptions options,
                                 boolean unwrapAsync, boolean nullableByDefault) {
        Type current = options.getReflectedType();
        if (unwrapAsync) {
            current = unwrapCompletionStage(current);
        }

        int reflectedDepth = 0;
        while (true) {
            if (current instanceof WildcardType wildcard) {
                current = wildcard.getUpperBounds()[0];
            } else if (current instanceof GenericArrayType array) {
                current = array.getGenericComponentType();
                reflectedDepth++;
            } else if (current instanceof Class<?> clazz && clazz.isArray()) {
                current = clazz.getComponentType();
                reflectedDepth++;
            } else if (current instanceof ParameterizedType parameterized && isIterable(parameterized.getRawType())) {
                current = parameterized.getActualTypeArguments()[0];
                reflectedDepth++;
            } else {
                break;
            }
        }

        Class<?> baseClass = options.getExplicitType() != null
                ? options.getExplicitType()
                : derivedBaseClass(declarationName, current);

        int listDepth = reflectedDepth;
        if (options.getListDepth() != null) {
            listDepth = options.getListDepth();
            if (listDepth < 0) {
                throw new CannotDetermineTypeException(declarationName, "list depth " + listDepth + " is negative");
            }
        }

        boolean nullable = options.getNullable() != null ? options.getNullable() : nullableByDefault;

        return TypeMetadata.of(toTypeValue(declarationName, baseClass), TypeModifiers.of(nullable, listDepth));
    }

    private Class<?> derivedBaseClass(String declarationName, Type type) {
        if (type instanceof TypeVariable<?> variable) {
            throw new CannotDetermineTypeException(declarationName, "type variable " + variable.getName() + " is unbound");
        }
        if (type instanceof ParameterizedType parameterized) {
            type = parameterized.getRawType();
        }
        if (type instanceof Class<?> clazz) {
            if (isIterable(clazz)) {
                throw new CannotDetermineTypeException(declarationName, "raw collection " + clazz.getSimpleName()
                        + " has no element type");
            }
            return clazz;
        }
        throw new CannotDetermineTypeException(declarationName, "unsupported type expression " + type.getTypeName());
    }

    private TypeValue toTypeValue(String declarationName, Class<?> baseClass) {
        Optional<GraphQLScalarType> scalar = scalarTypeMapper.findScalar(baseClass);
        if (scalar.isPresent()) {
            return new ScalarTypeValue(scalar.get());
        }
        if (scalarTypeMapper.isPlatformType(baseClass)) {
            throw new CannotDetermineTypeException(declarationName, baseClass.getName()
                    + " has no matching GraphQL type");
        }
        return new ClassTypeValue(baseClass);
    }

    private static Type unwrapCompletionStage(Type type) {
        Type current = type;
        while (current instanceof ParameterizedType parameterized
                && parameterized.getRawType() instanceof Class<?> raw
                && CompletionStage.class.isAssignableFrom(raw)) {
            current = parameterized.getActualTypeArguments()[0];
        }
        return current;
    }

    private static boolean isIterable(Type rawType) {
        return rawType instanceof Class<?> clazz && Iterable.class.isAssignableFrom(clazz);
    }
}
