package com.typegraph.schema.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Exposes a Java field of an {@link ObjectType} or {@link InputType} as a schema field.
 *
 * <pre>{@code
 * @ObjectType
 * public class User {
 *   @Field
 *   private Integer id;
 *
 *   @Field(nullable = Nullability.NULLABLE)
 *   private List<String> nicknames;
 * }
 * }</pre>
 */
@Documented
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Field {

    /**
     * Schema name; defaults to the Java field name.
     */
    String name() default "";

    String description() default "";

    /**
     * Explicit base type; {@code void.class} derives it from the Java field type.
     */
    Class<?> type() default void.class;

    Nullability nullable() default Nullability.DEFAULT;

    /**
     * Explicit list depth; {@code -1} derives it from the Java field type.
     */
    int listDepth() default -1;
}
