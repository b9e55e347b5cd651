package com.typegraph.schema.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Exposes a {@link Resolver} method as a query. Every parameter of the method must carry one of
 * {@link Arg}, {@link Args}, {@link Ctx} or {@link Info}.
 *
 * <p>The return type may be wrapped in a {@code CompletionStage}; the completed value is the query type.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Query {

    /**
     * Schema name; defaults to the method name.
     */
    String name() default "";

    String description() default "";

    /**
     * Explicit base return type; {@code void.class} derives it from the method signature.
     */
    Class<?> type() default void.class;

    Nullability nullable() default Nullability.DEFAULT;

    /**
     * Explicit list depth; {@code -1} derives it from the method signature.
     */
    int listDepth() default -1;
}
