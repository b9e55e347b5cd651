package com.typegraph.schema.metadata;

import lombok.NonNull;
import lombok.Value;

/**
 * Reference to a declared schema class (object type, input type or enum).
 */
@Value
public class ClassTypeValue implements TypeValue {

    @NonNull
    Class<?> typeClass;

    @Override
    public boolean isClassType() {
        return true;
    }

    @Override
    public String getTypeName() {
        return typeClass.getSimpleName();
    }
}
