package com.typegraph.schema.metadata.storage;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typegraph.schema.annotations.Arg;
import com.typegraph.schema.annotations.Args;
import com.typegraph.schema.annotations.Ctx;
import com.typegraph.schema.annotations.Field;
import com.typegraph.schema.annotations.Info;
import com.typegraph.schema.annotations.InputType;
import com.typegraph.schema.annotations.ObjectType;
import com.typegraph.schema.annotations.Query;
import com.typegraph.schema.annotations.Resolver;
import com.typegraph.schema.metadata.ParamKind;
import com.typegraph.schema.metadata.exception.DuplicateDeclarationException;
import com.typegraph.schema.metadata.exception.InvalidParameterDeclarationException;
import com.typegraph.schema.metadata.raw.RawFieldMetadata;
import com.typegraph.schema.metadata.raw.RawInputTypeMetadata;
import com.typegraph.schema.metadata.raw.RawObjectTypeMetadata;
import com.typegraph.schema.metadata.raw.RawParameterMetadata;
import com.typegraph.schema.metadata.raw.RawQueryMetadata;
import com.typegraph.schema.metadata.raw.RawResolverMetadata;
import com.typegraph.schema.metadata.raw.RawTypeOptions;

/**
 * Reads schema annotations from classes and registers the raw declarations in a storage.
 *
 * Only collects; it performs no type resolution and no cross-member validation beyond what is
 * needed to key the declarations (one annotation per parameter, no overloaded queries).
 * A class is read and checked in full first, so a rejected class leaves nothing in the storage.
 */
public class AnnotationMetadataCollector {
    private static final Logger log = LoggerFactory.getLogger(AnnotationMetadataCollector.class);

    private final InMemoryRawMetadataStorage storage;

    /** Classes already collected, so repeated calls are no-ops. */
    private final Set<Class<?>> collected = new HashSet<>();

    public AnnotationMetadataCollector(InMemoryRawMetadataStorage storage) {
        this.storage = Objects.requireNonNull(storage, "storage");
    }

    /**
     * Collect every schema annotation found on the given classes.
     */
    public void collect(Class<?>... classes) {
        collect(Arrays.asList(classes));
    }

    public synchronized void collect(List<Class<?>> classes) {
        Objects.requireNonNull(classes, "classes");
        for (Class<?> type : classes) {
            if (!collected.contains(type)) {
                collectClass(type);
                collected.add(type);
            }
        }
    }

    private void collectClass(Class<?> type) {
        ClassDeclarations declarations = readDeclarations(type);
        checkNotRegistered(declarations);
        register(declarations);
        log.debug("Collected declarations of {}", type.getName());
    }

    /**
     * Reads and validates every declaration of the class without touching the storage.
     */
    private ClassDeclarations readDeclarations(Class<?> type) {
        RawObjectTypeMetadata objectTypeMetadata = null;
        ObjectType objectType = type.getAnnotation(ObjectType.class);
        if (objectType != null) {
            objectTypeMetadata = RawObjectTypeMetadata.builder()
                    .target(type)
                    .schemaName(orDefault(objectType.name(), type.getSimpleName()))
                    .description(emptyToNull(objectType.description()))
                    .build();
        }

        RawInputTypeMetadata inputTypeMetadata = null;
        InputType inputType = type.getAnnotation(InputType.class);
        if (inputType != null) {
            inputTypeMetadata = RawInputTypeMetadata.builder()
                    .target(type)
                    .schemaName(orDefault(inputType.name(), type.getSimpleName()))
                    .description(emptyToNull(inputType.description()))
                    .build();
        }

        List<RawFieldMetadata> fields = objectType != null || inputType != null ? readFields(type) : List.of();

        RawResolverMetadata resolverMetadata = null;
        List<RawQueryMetadata> queries = new ArrayList<>();
        List<RawParameterMetadata> parameters = new ArrayList<>();
        Resolver resolver = type.getAnnotation(Resolver.class);
        if (resolver != null) {
            resolverMetadata = RawResolverMetadata.builder()
                    .target(type)
                    .objectType(explicitType(resolver.value()))
                    .description(emptyToNull(resolver.description()))
                    .build();
            readQueries(type, queries, parameters);
        }

        return new ClassDeclarations(objectTypeMetadata, inputTypeMetadata, fields,
                resolverMetadata, queries, parameters);
    }

    private List<RawFieldMetadata> readFields(Class<?> type) {
        List<RawFieldMetadata> fields = new ArrayList<>();
        // getDeclaredFields() follows declaration order on the JVMs we run on
        for (java.lang.reflect.Field field : type.getDeclaredFields()) {
            Field annotation = field.getAnnotation(Field.class);
            if (annotation == null || Modifier.isStatic(field.getModifiers())) {
                continue;
            }
            fields.add(RawFieldMetadata.builder()
                    .target(type)
                    .propertyKey(field.getName())
                    .schemaName(orDefault(annotation.name(), field.getName()))
                    .description(emptyToNull(annotation.description()))
                    .typeOptions(RawTypeOptions.builder()
                            .reflectedType(field.getGenericType())
                            .explicitType(explicitType(annotation.type()))
                            .nullable(annotation.nullable().toOverride())
                            .listDepth(explicitListDepth(annotation.listDepth()))
                            .build())
                    .build());
        }
        return fields;
    }

    private void readQueries(Class<?> resolverClass, List<RawQueryMetadata> queries,
                             List<RawParameterMetadata> parameters) {
        // Method order is unspecified by reflection; sort for a stable schema.
        List<Method> methods = new ArrayList<>();
        for (Method method : resolverClass.getDeclaredMethods()) {
            if (method.isAnnotationPresent(Query.class) && !method.isSynthetic()) {
                methods.add(method);
            }
        }
        methods.sort(Comparator.comparing(Method::getName));

        Set<String> methodNames = new HashSet<>();
        for (Method method : methods) {
            if (!methodNames.add(method.getName())) {
                throw new DuplicateDeclarationException(resolverClass.getSimpleName() + "." + method.getName(),
                        "overloaded @Query methods are not supported");
            }
            queries.add(toRawQuery(resolverClass, method));
            Parameter[] declared = method.getParameters();
            for (int index = 0; index < declared.length; index++) {
                parameters.add(toRawParameter(resolverClass, method, index, declared[index]));
            }
        }
    }

    private void checkNotRegistered(ClassDeclarations declarations) {
        if (declarations.objectType() != null
                && storage.findObjectTypeMetadata(declarations.objectType().getTarget()).isPresent()) {
            throw new DuplicateDeclarationException(declarations.objectType().getTarget().getName(),
                    "object type is already registered");
        }
        if (declarations.inputType() != null
                && storage.findInputTypeMetadata(declarations.inputType().getTarget()).isPresent()) {
            throw new DuplicateDeclarationException(declarations.inputType().getTarget().getName(),
                    "input type is already registered");
        }
        if (declarations.resolver() != null
                && storage.findResolverMetadata(declarations.resolver().getTarget()).isPresent()) {
            throw new DuplicateDeclarationException(declarations.resolver().getTarget().getName(),
                    "resolver is already registered");
        }
    }

    private void register(ClassDeclarations declarations) {
        if (declarations.objectType() != null) {
            storage.collectObjectTypeMetadata(declarations.objectType());
        }
        if (declarations.inputType() != null) {
            storage.collectInputTypeMetadata(declarations.inputType());
        }
        declarations.fields().forEach(storage::collectFieldMetadata);
        if (declarations.resolver() != null) {
            storage.collectResolverMetadata(declarations.resolver());
        }
        declarations.queries().forEach(storage::collectQueryMetadata);
        declarations.parameters().forEach(storage::collectParameterMetadata);
    }

    private RawQueryMetadata toRawQuery(Class<?> resolverClass, Method method) {
        Query annotation = method.getAnnotation(Query.class);
        return RawQueryMetadata.builder()
                .target(resolverClass)
                .propertyKey(method.getName())
                .schemaName(orDefault(annotation.name(), method.getName()))
                .description(emptyToNull(annotation.description()))
                .typeOptions(RawTypeOptions.builder()
                        .reflectedType(method.getGenericReturnType())
                        .explicitType(explicitType(annotation.type()))
                        .nullable(annotation.nullable().toOverride())
                        .listDepth(explicitListDepth(annotation.listDepth()))
                        .build())
                .build();
    }

    private RawParameterMetadata toRawParameter(Class<?> resolverClass, Method method, int index, Parameter parameter) {
        Arg arg = parameter.getAnnotation(Arg.class);
        Args args = parameter.getAnnotation(Args.class);
        boolean ctx = parameter.isAnnotationPresent(Ctx.class);
        boolean info = parameter.isAnnotationPresent(Info.class);

        String declarationName = resolverClass.getSimpleName() + "." + method.getName() + "#" + index;
        int annotationCount = (arg != null ? 1 : 0) + (args != null ? 1 : 0) + (ctx ? 1 : 0) + (info ? 1 : 0);
        if (annotationCount == 0) {
            throw new InvalidParameterDeclarationException(declarationName,
                    "missing one of @Arg, @Args, @Ctx or @Info");
        }
        if (annotationCount > 1) {
            throw new InvalidParameterDeclarationException(declarationName,
                    "only one of @Arg, @Args, @Ctx or @Info may be used");
        }

        RawParameterMetadata.RawParameterMetadataBuilder builder = RawParameterMetadata.builder()
                .target(resolverClass)
                .propertyKey(method.getName())
                .index(index);
        RawTypeOptions.RawTypeOptionsBuilder typeOptions = RawTypeOptions.builder()
                .reflectedType(parameter.getParameterizedType());

        if (arg != null) {
            builder.kind(ParamKind.SINGLE_ARG)
                    .name(arg.value())
                    .description(emptyToNull(arg.description()));
            typeOptions.explicitType(explicitType(arg.type()))
                    .nullable(arg.nullable().toOverride())
                    .listDepth(explicitListDepth(arg.listDepth()));
        } else if (args != null) {
            builder.kind(ParamKind.SPREAD_ARGS);
            typeOptions.explicitType(explicitType(args.type()))
                    .nullable(args.nullable().toOverride());
        } else if (ctx) {
            builder.kind(ParamKind.CONTEXT);
        } else {
            builder.kind(ParamKind.INFO);
        }
        return builder.typeOptions(typeOptions.build()).build();
    }

    private static Class<?> explicitType(Class<?> declared) {
        return declared == void.class ? null : declared;
    }

    private static Integer explicitListDepth(int declared) {
        return declared < 0 ? null : declared;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    /** Everything one class declares; absent categories are {@code null}. */
    private record ClassDeclarations(RawObjectTypeMetadata objectType,
                                     RawInputTypeMetadata inputType,
                                     List<RawFieldMetadata> fields,
                                     RawResolverMetadata resolver,
                                     List<RawQueryMetadata> queries,
                                     List<RawParameterMetadata> parameters) {
    }
}
