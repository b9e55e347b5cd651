package com.typegraph.schema.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typegraph.schema.build.SchemaBuildPass;
import com.typegraph.schema.build.SchemaBuildResult;
import com.typegraph.schema.cli.exception.OptionsValidationException;
import com.typegraph.schema.cli.model.InspectOptions;
import com.typegraph.schema.cli.model.ValidatedInspectOptions;
import com.typegraph.schema.cli.output.InspectResultsPrinter;
import com.typegraph.schema.cli.output.SchemaReportRenderer;
import com.typegraph.schema.cli.validation.InspectOptionsValidator;
import com.typegraph.schema.config.BuildSchemaConfig;
import com.typegraph.schema.metadata.exception.SchemaMetadataException;
import com.typegraph.schema.metadata.reflection.DefaultTypeReflection;
import com.typegraph.schema.metadata.storage.AnnotationMetadataCollector;
import com.typegraph.schema.metadata.storage.InMemoryRawMetadataStorage;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that resolves annotated classes into schema metadata and reports the result.
 */
@Command(
        name = "inspect",
        mixinStandardHelpOptions = true,
        version = "schema-metadata-builder 1.0.0",
        description = "Resolves annotated object types, input types and resolvers into validated schema metadata."
)
public class InspectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InspectCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_RESOLUTION_FAILED = 1;
    static final int EXIT_INVALID_OPTIONS = 2;

    @Mixin
    private InspectOptions options = new InspectOptions();

    private final InspectOptionsValidator validator = new InspectOptionsValidator();
    private final InspectResultsPrinter printer = new InspectResultsPrinter();
    private final SchemaReportRenderer renderer = new SchemaReportRenderer();

    @Override
    public Integer call() {
        ValidatedInspectOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getMessage().lines().forEach(log::error);
            return EXIT_INVALID_OPTIONS;
        }

        printer.printBanner(options, validated);

        InMemoryRawMetadataStorage storage = new InMemoryRawMetadataStorage();
        try {
            new AnnotationMetadataCollector(storage).collect(validated.getClasses());
        } catch (SchemaMetadataException e) {
            log.error("Failed to collect declarations: {}", e.getMessage());
            return EXIT_RESOLUTION_FAILED;
        }

        BuildSchemaConfig config = BuildSchemaConfig.builder()
                .nullableByDefault(options.isNullableByDefault())
                .build();
        SchemaBuildResult result = new SchemaBuildPass(config, storage, new DefaultTypeReflection())
                .build(validated.getClasses());

        String report = renderer.render(result);
        if (validated.getOutputFile() != null) {
            try {
                Files.writeString(validated.getOutputFile(), report);
            } catch (IOException e) {
                log.error("Failed to write report to {}", validated.getOutputFile(), e);
                return EXIT_RESOLUTION_FAILED;
            }
        } else {
            printer.printReport(report);
        }

        if (!result.isSuccess()) {
            printer.printFailure(result);
            return EXIT_RESOLUTION_FAILED;
        }

        printer.printSuccess(result, validated.getOutputFile());
        return EXIT_OK;
    }
}
