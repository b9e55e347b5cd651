package com.typegraph.schema.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a GraphQL input type.
 * Its schema fields are the Java fields annotated with {@link Field}.
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface InputType {

    /**
     * Schema name; defaults to the simple class name.
     */
    String name() default "";

    String description() default "";
}
