package com.typegraph.schema.metadata;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Nullability and list nesting of a resolved type.
 */
@Value
@AllArgsConstructor(staticName = "of")
public class TypeModifiers {

    /**
     * Whether the value itself may be null. List items are never null.
     */
    boolean nullable;

    /**
     * 0 for a plain value, N for a list nested N levels deep.
     */
    int listDepth;

    public boolean isList() {
        return listDepth > 0;
    }
}
