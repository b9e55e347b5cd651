package com.typegraph.schema.build;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typegraph.schema.config.BuildSchemaConfig;
import com.typegraph.schema.metadata.MetadataCategory;
import com.typegraph.schema.metadata.builder.MetadataBuilder;
import com.typegraph.schema.metadata.exception.SchemaMetadataException;
import com.typegraph.schema.metadata.reflection.TypeReflection;
import com.typegraph.schema.metadata.storage.RawMetadataStorage;

/**
 * Resolves the metadata of a set of classes and gathers every declaration error into one report
 * instead of stopping at the first.
 *
 * Owns a single {@link MetadataBuilder}, so the metadata caches live exactly as long as the pass.
 */
public class SchemaBuildPass {
    private static final Logger log = LoggerFactory.getLogger(SchemaBuildPass.class);

    private final RawMetadataStorage storage;
    private final MetadataBuilder metadataBuilder;

    public SchemaBuildPass(BuildSchemaConfig config, RawMetadataStorage storage, TypeReflection typeReflection) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.metadataBuilder = new MetadataBuilder(config, storage, typeReflection);
    }

    /**
     * Resolve each class as every category it was declared with.
     */
    public SchemaBuildResult build(List<Class<?>> classes) {
        Objects.requireNonNull(classes, "classes");

        BuildDiagnostics diagnostics = new BuildDiagnostics();
        SchemaBuildResult.SchemaBuildResultBuilder result = SchemaBuildResult.builder().diagnostics(diagnostics);

        for (Class<?> type : classes) {
            boolean declared = false;

            if (storage.findObjectTypeMetadata(type).isPresent()) {
                declared = true;
                resolve(type, MetadataCategory.OBJECT_TYPE, metadataBuilder::resolveObjectType, diagnostics)
                        .ifPresent(result::objectType);
            }
            if (storage.findInputTypeMetadata(type).isPresent()) {
                declared = true;
                resolve(type, MetadataCategory.INPUT_TYPE, metadataBuilder::resolveInputType, diagnostics)
                        .ifPresent(result::inputType);
            }
            if (storage.findResolverMetadata(type).isPresent()) {
                declared = true;
                resolve(type, MetadataCategory.RESOLVER, metadataBuilder::resolveResolver, diagnostics)
                        .ifPresent(result::resolver);
            }

            if (!declared) {
                diagnostics.recordSkipped(type);
                log.warn("Class {} has no schema declaration and was skipped", type.getName());
            }
        }

        diagnostics.addInfo("Resolved " + classes.size() + " class(es) with "
                + diagnostics.getErrors().size() + " error(s)");
        return result.build();
    }

    private <T> Optional<T> resolve(Class<?> type, MetadataCategory category, Function<Class<?>, T> resolver,
                                    BuildDiagnostics diagnostics) {
        try {
            return Optional.of(resolver.apply(type));
        } catch (SchemaMetadataException e) {
            diagnostics.recordError(type, category, e);
            log.error("Failed to resolve {} {}: {}", category.getLabel(), type.getName(), e.getMessage());
            return Optional.empty();
        }
    }
}
