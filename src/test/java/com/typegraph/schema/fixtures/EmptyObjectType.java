package com.typegraph.schema.fixtures;

import com.typegraph.schema.annotations.ObjectType;

@ObjectType
public class EmptyObjectType {

    private String notAField;
}
