package com.typegraph.schema.metadata;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Category of raw class declaration a lookup expects.
 */
@Getter
@RequiredArgsConstructor
public enum MetadataCategory {
    OBJECT_TYPE("ObjectType"),
    INPUT_TYPE("InputType"),
    RESOLVER("Resolver");

    private final String label;
}
