package com.typegraph.schema.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a resolver grouping {@link Query} handler methods.
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Resolver {

    /**
     * Object type the resolver belongs to; {@code void.class} when it only contributes root queries.
     */
    Class<?> value() default void.class;

    String description() default "";
}
