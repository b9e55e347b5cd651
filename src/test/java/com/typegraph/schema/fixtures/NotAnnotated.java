package com.typegraph.schema.fixtures;

public class NotAnnotated {
}
