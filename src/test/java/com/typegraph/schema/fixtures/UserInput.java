package com.typegraph.schema.fixtures;

import com.typegraph.schema.annotations.Field;
import com.typegraph.schema.annotations.InputType;
import com.typegraph.schema.annotations.Nullability;

@InputType
public class UserInput {

    @Field
    private String name;

    @Field(nullable = Nullability.NULLABLE)
    private Integer age;
}
