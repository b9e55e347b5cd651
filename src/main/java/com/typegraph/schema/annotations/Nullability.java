package com.typegraph.schema.annotations;

/**
 * Explicit nullability override for a declared member.
 */
public enum Nullability {
    /** Use the build-wide default. */
    DEFAULT,
    NULLABLE,
    NON_NULL;

    /**
     * @return the override, or {@code null} for {@link #DEFAULT}
     */
    public Boolean toOverride() {
        return switch (this) {
            case DEFAULT -> null;
            case NULLABLE -> Boolean.TRUE;
            case NON_NULL -> Boolean.FALSE;
        };
    }
}
