package com.typegraph.schema.metadata.builder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typegraph.schema.config.BuildSchemaConfig;
import com.typegraph.schema.metadata.FieldMetadata;
import com.typegraph.schema.metadata.InputTypeMetadata;
import com.typegraph.schema.metadata.MetadataCategory;
import com.typegraph.schema.metadata.ObjectTypeMetadata;
import com.typegraph.schema.metadata.ParamKind;
import com.typegraph.schema.metadata.ParameterMetadata;
import com.typegraph.schema.metadata.QueryMetadata;
import com.typegraph.schema.metadata.ResolverMetadata;
import com.typegraph.schema.metadata.TypeMetadata;
import com.typegraph.schema.metadata.exception.MissingClassMetadataException;
import com.typegraph.schema.metadata.exception.MissingFieldsException;
import com.typegraph.schema.metadata.exception.MissingResolverMethodsException;
import com.typegraph.schema.metadata.exception.MultipleArgsUsageException;
import com.typegraph.schema.metadata.exception.SimultaneousArgsUsageException;
import com.typegraph.schema.metadata.exception.WrongArgsTypeException;
import com.typegraph.schema.metadata.raw.RawFieldMetadata;
import com.typegraph.schema.metadata.raw.RawInputTypeMetadata;
import com.typegraph.schema.metadata.raw.RawObjectTypeMetadata;
import com.typegraph.schema.metadata.raw.RawParameterMetadata;
import com.typegraph.schema.metadata.raw.RawQueryMetadata;
import com.typegraph.schema.metadata.raw.RawResolverMetadata;
import com.typegraph.schema.metadata.reflection.TypeReflection;
import com.typegraph.schema.metadata.storage.RawMetadataStorage;

/**
 * Builds validated, typed metadata for object types, input types and resolvers from the raw
 * declarations in a {@link RawMetadataStorage}.
 *
 * Results are memoized per class and kind; the three caches are independent. Failed builds are
 * not cached. Concurrent first builds of the same class may both do the work; the results are
 * equal since building is a pure function of the storage contents and the configuration.
 */
public class MetadataBuilder {
    private static final Logger log = LoggerFactory.getLogger(MetadataBuilder.class);

    private final BuildSchemaConfig config;
    private final RawMetadataStorage storage;
    private final TypeReflection typeReflection;

    private final ClassMetadataCache<ObjectTypeMetadata> objectTypeMetadataByClass =
            new ClassMetadataCache<>(this::buildObjectTypeMetadata);
    private final ClassMetadataCache<InputTypeMetadata> inputTypeMetadataByClass =
            new ClassMetadataCache<>(this::buildInputTypeMetadata);
    private final ClassMetadataCache<ResolverMetadata> resolverMetadataByClass =
            new ClassMetadataCache<>(this::buildResolverMetadata);

    public MetadataBuilder(BuildSchemaConfig config, RawMetadataStorage storage, TypeReflection typeReflection) {
        this.config = Objects.requireNonNull(config, "config");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.typeReflection = Objects.requireNonNull(typeReflection, "typeReflection");
        log.debug("Created MetadataBuilder with {}", config);
    }

    public ObjectTypeMetadata resolveObjectType(Class<?> typeClass) {
        return objectTypeMetadataByClass.get(typeClass);
    }

    public InputTypeMetadata resolveInputType(Class<?> typeClass) {
        return inputTypeMetadataByClass.get(typeClass);
    }

    public ResolverMetadata resolveResolver(Class<?> resolverClass) {
        return resolverMetadataByClass.get(resolverClass);
    }

    private ObjectTypeMetadata buildObjectTypeMetadata(Class<?> typeClass) {
        log.debug("Building object type metadata for {}", typeClass.getName());
        RawObjectTypeMetadata raw = storage.findObjectTypeMetadata(typeClass)
                .orElseThrow(() -> new MissingClassMetadataException(typeClass, MetadataCategory.OBJECT_TYPE));

        return ObjectTypeMetadata.builder()
                .raw(raw)
                .fields(buildFieldsMetadata(typeClass))
                .build();
    }

    private InputTypeMetadata buildInputTypeMetadata(Class<?> typeClass) {
        log.debug("Building input type metadata for {}", typeClass.getName());
        RawInputTypeMetadata raw = storage.findInputTypeMetadata(typeClass)
                .orElseThrow(() -> new MissingClassMetadataException(typeClass, MetadataCategory.INPUT_TYPE));

        return InputTypeMetadata.builder()
                .raw(raw)
                .fields(buildFieldsMetadata(typeClass))
                .build();
    }

    private List<FieldMetadata> buildFieldsMetadata(Class<?> typeClass) {
        List<RawFieldMetadata> rawFields = storage.findFieldsMetadata(typeClass).orElse(List.of());
        if (rawFields.isEmpty()) {
            throw new MissingFieldsException(typeClass);
        }

        List<FieldMetadata> fields = new ArrayList<>(rawFields.size());
        for (RawFieldMetadata rawField : rawFields) {
            fields.add(FieldMetadata.builder()
                    .raw(rawField)
                    .type(typeReflection.resolveFieldType(rawField, config.isNullableByDefault()))
                    .build());
        }
        return fields;
    }

    private ResolverMetadata buildResolverMetadata(Class<?> resolverClass) {
        log.debug("Building resolver metadata for {}", resolverClass.getName());
        RawResolverMetadata raw = storage.findResolverMetadata(resolverClass)
                .orElseThrow(() -> new MissingClassMetadataException(resolverClass, MetadataCategory.RESOLVER));

        // TODO: require mutation and subscription methods too once they are collected
        List<RawQueryMetadata> rawQueries = storage.findQueriesMetadata(resolverClass).orElse(List.of());
        if (rawQueries.isEmpty()) {
            throw new MissingResolverMethodsException(resolverClass);
        }

        List<QueryMetadata> queries = new ArrayList<>(rawQueries.size());
        for (RawQueryMetadata rawQuery : rawQueries) {
            queries.add(buildQueryMetadata(resolverClass, rawQuery));
        }

        return ResolverMetadata.builder()
                .raw(raw)
                .queries(queries)
                .build();
    }

    private QueryMetadata buildQueryMetadata(Class<?> resolverClass, RawQueryMetadata rawQuery) {
        TypeMetadata returnType = typeReflection.resolveQueryReturnType(rawQuery, config.isNullableByDefault());

        List<RawParameterMetadata> rawParameters = storage
                .findParametersMetadata(resolverClass, rawQuery.getPropertyKey())
                .orElse(List.of());

        long spreadArgsCount = countOfKind(rawParameters, ParamKind.SPREAD_ARGS);
        if (spreadArgsCount > 1) {
            throw new MultipleArgsUsageException(rawQuery);
        }
        long singleArgCount = countOfKind(rawParameters, ParamKind.SINGLE_ARG);
        if (spreadArgsCount > 0 && singleArgCount > 0) {
            throw new SimultaneousArgsUsageException(rawQuery);
        }

        List<ParameterMetadata> parameters = new ArrayList<>(rawParameters.size());
        for (RawParameterMetadata rawParameter : rawParameters) {
            parameters.add(buildParameterMetadata(rawParameter));
        }

        return QueryMetadata.builder()
                .raw(rawQuery)
                .type(returnType)
                .parameters(parameters)
                .build();
    }

    private ParameterMetadata buildParameterMetadata(RawParameterMetadata rawParameter) {
        TypeMetadata type = switch (rawParameter.getKind()) {
            case SINGLE_ARG -> typeReflection.resolveParameterType(rawParameter, config.isNullableByDefault());
            case SPREAD_ARGS -> {
                TypeMetadata argsType = typeReflection.resolveParameterType(rawParameter, config.isNullableByDefault());
                if (!argsType.getValue().isClassType() || argsType.getModifiers().isList()) {
                    throw new WrongArgsTypeException(rawParameter);
                }
                yield argsType;
            }
            case CONTEXT, INFO -> null;
        };

        return ParameterMetadata.builder()
                .raw(rawParameter)
                .type(type)
                .build();
    }

    private static long countOfKind(List<RawParameterMetadata> parameters, ParamKind kind) {
        return parameters.stream().filter(parameter -> parameter.getKind() == kind).count();
    }
}
