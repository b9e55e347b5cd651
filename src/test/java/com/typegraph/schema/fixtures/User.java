package com.typegraph.schema.fixtures;

import java.util.List;

import com.typegraph.schema.annotations.Field;
import com.typegraph.schema.annotations.Nullability;
import com.typegraph.schema.annotations.ObjectType;

@ObjectType(description = "A registered user")
public class User {

    @Field
    private int id;

    @Field(name = "displayName")
    private String name;

    @Field(nullable = Nullability.NULLABLE)
    private List<String> nicknames;

    // Not exposed
    private String passwordHash;
}
