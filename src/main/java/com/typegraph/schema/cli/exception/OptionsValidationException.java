package com.typegraph.schema.cli.exception;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every problem found in the inspect options, grouped by the option it concerns.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Map<String, List<String>> errorsByOption;

    /**
     * @param errorsByOption problems keyed by long option name, in reporting order
     */
    public OptionsValidationException(Map<String, List<String>> errorsByOption) {
        super(describe(errorsByOption));
        Map<String, List<String>> copy = new LinkedHashMap<>();
        errorsByOption.forEach((option, errors) -> copy.put(option, List.copyOf(errors)));
        this.errorsByOption = copy;
    }

    /**
     * All problems in reporting order.
     */
    public List<String> getErrors() {
        List<String> errors = new ArrayList<>();
        errorsByOption.values().forEach(errors::addAll);
        return errors;
    }

    public List<String> getErrorsFor(String option) {
        return errorsByOption.getOrDefault(option, List.of());
    }

    private static String describe(Map<String, List<String>> errorsByOption) {
        List<String> lines = new ArrayList<>();
        errorsByOption.forEach((option, errors) -> errors.forEach(error -> lines.add(option + ": " + error)));
        return String.join(System.lineSeparator(), lines);
    }
}
