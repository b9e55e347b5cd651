package com.typegraph.schema.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "inspect" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class InspectOptions {

	@Option(names = { "--class", "-c" }, required = true, paramLabel = "<fqcn>",
			description = "Fully-qualified name of an annotated class to resolve (repeatable)")
	private List<String> classNames = new ArrayList<>();

	@Option(names = { "--nullable-by-default" },
			description = "Treat fields, queries and arguments without an explicit nullability as nullable")
	private boolean nullableByDefault;

	@Option(names = { "--output", "-o" }, description = "Write the report to this file instead of the log")
	private Path outputFile;

}
