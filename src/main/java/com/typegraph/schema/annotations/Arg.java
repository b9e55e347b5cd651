package com.typegraph.schema.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds one named query argument to the parameter. Cannot be combined with {@link Args}
 * on the same method.
 */
@Documented
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
public @interface Arg {

    /**
     * Argument name.
     */
    String value();

    String description() default "";

    Class<?> type() default void.class;

    Nullability nullable() default Nullability.DEFAULT;

    int listDepth() default -1;
}
