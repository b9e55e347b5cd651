package com.typegraph.schema.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.typegraph.schema.cli.exception.OptionsValidationException;
import com.typegraph.schema.cli.model.InspectOptions;
import com.typegraph.schema.cli.model.ValidatedInspectOptions;

public class InspectOptionsValidator {

	private static final String CLASS_OPTION = "--class";
	private static final String OUTPUT_OPTION = "--output";

	private final ClassLoader classLoader;

	public InspectOptionsValidator() {
		this(Thread.currentThread().getContextClassLoader());
	}

	public InspectOptionsValidator(ClassLoader classLoader) {
		this.classLoader = classLoader;
	}

	public ValidatedInspectOptions validate(InspectOptions o) {
		Map<String, List<String>> errors = new LinkedHashMap<>();

		List<String> classNames = o.getClassNames() == null ? List.of() : o.getClassNames();
		if (classNames.isEmpty()) {
			error(errors, CLASS_OPTION, "At least one class is required (--class / -c).");
		}

		List<Class<?>> classes = new ArrayList<>();
		for (String className : classNames) {
			if (isBlank(className)) {
				error(errors, CLASS_OPTION, "Class name must not be blank.");
				continue;
			}
			try {
				// Don't initialize: only annotations are read
				classes.add(Class.forName(className.trim(), false, classLoader));
			} catch (ClassNotFoundException | LinkageError e) {
				error(errors, CLASS_OPTION, "Class not found on the classpath: " + className.trim());
			}
		}

		Path outputFile = null;
		if (o.getOutputFile() != null) {
			outputFile = o.getOutputFile().toAbsolutePath().normalize();
			Path parent = outputFile.getParent();
			if (parent != null && !Files.isDirectory(parent)) {
				error(errors, OUTPUT_OPTION, "Output directory does not exist: " + parent);
			}
			if (Files.isDirectory(outputFile)) {
				error(errors, OUTPUT_OPTION, "Output path is a directory: " + outputFile);
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedInspectOptions(List.copyOf(classes), outputFile);
	}

	private static void error(Map<String, List<String>> errors, String option, String message) {
		errors.computeIfAbsent(option, k -> new ArrayList<>()).add(message);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
