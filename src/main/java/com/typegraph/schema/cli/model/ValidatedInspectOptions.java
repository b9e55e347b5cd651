package com.typegraph.schema.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps InspectCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedInspectOptions {
    List<Class<?>> classes;
    Path outputFile;
}
