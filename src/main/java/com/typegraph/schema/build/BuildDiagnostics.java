package com.typegraph.schema.build;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import com.typegraph.schema.metadata.MetadataCategory;
import com.typegraph.schema.metadata.exception.SchemaMetadataException;

/**
 * What went wrong, or was skipped, while resolving the classes of one build pass.
 *
 * Errors keep the failing class and category so callers can tell an object type failure of a
 * class apart from a resolver failure of the same class.
 */
public class BuildDiagnostics {
    private final List<ResolutionError> errors = new ArrayList<>();
    private final List<Class<?>> skippedClasses = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public void recordError(Class<?> typeClass, MetadataCategory category, SchemaMetadataException cause) {
        errors.add(new ResolutionError(typeClass, category, cause));
    }

    /**
     * A class with no schema declaration at all.
     */
    public void recordSkipped(Class<?> typeClass) {
        skippedClasses.add(typeClass);
    }

    public void addInfo(String info) {
        infos.add(info);
    }

    public List<ResolutionError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<ResolutionError> getErrorsFor(Class<?> typeClass) {
        return errors.stream()
                .filter(error -> error.getTypeClass().equals(typeClass))
                .collect(Collectors.toUnmodifiableList());
    }

    public List<Class<?>> getSkippedClasses() {
        return Collections.unmodifiableList(skippedClasses);
    }

    public List<String> getWarnings() {
        return skippedClasses.stream()
                .map(type -> "Class " + type.getName() + " has no schema declaration and was skipped")
                .collect(Collectors.toUnmodifiableList());
    }

    public List<String> getInfos() {
        return Collections.unmodifiableList(infos);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
