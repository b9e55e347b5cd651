package com.typegraph.schema.metadata;

import java.util.List;

import com.typegraph.schema.metadata.raw.RawResolverMetadata;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Resolved resolver class: its declaration plus at least one resolved query.
 */
@Value
@Builder(toBuilder = true)
public class ResolverMetadata {

    @NonNull
    RawResolverMetadata raw;

    @NonNull
    @Singular
    List<QueryMetadata> queries;

    public Class<?> getTarget() {
        return raw.getTarget();
    }

    public String getResolverName() {
        return raw.getTarget().getSimpleName();
    }
}
