package com.typegraph.schema.metadata;

import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * Normalized type of a field, query or parameter.
 *
 * Pure structure only: computed by a {@code TypeReflection} from a raw declaration.
 */
@Value
@AllArgsConstructor(staticName = "of")
public class TypeMetadata {

    @NonNull
    TypeValue value;

    @NonNull
    TypeModifiers modifiers;

    /**
     * Renders the type the way it reads in SDL, e.g. {@code [User!]!} or {@code Int}.
     * List items are always rendered non-null.
     */
    public String toTypeString() {
        StringBuilder rendered = new StringBuilder(value.getTypeName());
        for (int depth = 0; depth < modifiers.getListDepth(); depth++) {
            rendered.append('!').insert(0, '[').append(']');
        }
        if (!modifiers.isNullable()) {
            rendered.append('!');
        }
        return rendered.toString();
    }
}
