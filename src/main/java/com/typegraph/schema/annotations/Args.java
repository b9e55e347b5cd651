package com.typegraph.schema.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Spreads all query arguments into the parameter, which must be a single {@link InputType}
 * class (not a scalar, not a list). At most one per method.
 */
@Documented
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
public @interface Args {

    Class<?> type() default void.class;

    Nullability nullable() default Nullability.DEFAULT;
}
