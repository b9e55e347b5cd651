package com.typegraph.schema.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typegraph.schema.build.ResolutionError;
import com.typegraph.schema.build.SchemaBuildResult;
import com.typegraph.schema.cli.model.InspectOptions;
import com.typegraph.schema.cli.model.ValidatedInspectOptions;

/**
 * Responsible only for printing CLI output for the "inspect" command.
 * No validation, no execution, no rendering.
 */
public class InspectResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(InspectResultsPrinter.class);

    public void printBanner(InspectOptions o, ValidatedInspectOptions v) {
        log.info("=================================================");
        log.info("Schema Metadata Inspector");
        log.info("=================================================");
        log.info("Classes: {}", v.getClasses().size());
        for (Class<?> type : v.getClasses()) {
            log.info("  {}", type.getName());
        }
        log.info("Nullable By Default: {}", o.isNullableByDefault());
        log.info("Report: {}", v.getOutputFile() != null ? v.getOutputFile() : "log");
        log.info("=================================================");
    }

    public void printReport(String report) {
        report.lines().forEach(log::info);
    }

    public void printSuccess(SchemaBuildResult result, Path outputFile) {
        log.info("");
        log.info("=================================================");
        log.info("RESOLUTION SUCCESSFUL");
        log.info("=================================================");
        printCounts(result);
        if (outputFile != null) {
            log.info("Report written to: {}", outputFile);
        }
        for (String warning : result.getDiagnostics().getWarnings()) {
            log.warn("  {}", warning);
        }
        log.info("=================================================");
    }

    public void printFailure(SchemaBuildResult result) {
        log.error("Resolution failed with {} error(s):", result.getDiagnostics().getErrors().size());
        for (ResolutionError error : result.getDiagnostics().getErrors()) {
            log.error("  [{}] {}", error.getCategory().getLabel(), error.getMessage());
        }
        printCounts(result);
    }

    private void printCounts(SchemaBuildResult result) {
        log.info("Object Types: {}", result.getObjectTypes().size());
        log.info("Input Types: {}", result.getInputTypes().size());
        log.info("Resolvers: {}", result.getResolvers().size());
        int queryCount = result.getResolvers().stream().mapToInt(resolver -> resolver.getQueries().size()).sum();
        log.info("Queries: {}", queryCount);
    }
}
