package com.typegraph.schema;

import com.typegraph.schema.cli.InspectCommand;
import picocli.CommandLine;

/**
 * Main entry point for the schema metadata inspector.
 * Resolves annotated classes on the classpath into validated GraphQL schema metadata
 * and prints a report of the result.
 */
public class SchemaMetadataApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new InspectCommand()).execute(args);
        System.exit(exitCode);
    }
}
