package com.typegraph.schema.build;

import java.util.List;

import com.typegraph.schema.metadata.InputTypeMetadata;
import com.typegraph.schema.metadata.ObjectTypeMetadata;
import com.typegraph.schema.metadata.ResolverMetadata;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of a schema build pass: every piece of metadata that resolved, plus the diagnostics
 * of the pieces that did not.
 */
@Value
@Builder
public class SchemaBuildResult {

    @Singular
    List<ObjectTypeMetadata> objectTypes;

    @Singular
    List<InputTypeMetadata> inputTypes;

    @Singular
    List<ResolverMetadata> resolvers;

    @NonNull
    BuildDiagnostics diagnostics;

    public boolean isSuccess() {
        return !diagnostics.hasErrors();
    }
}
