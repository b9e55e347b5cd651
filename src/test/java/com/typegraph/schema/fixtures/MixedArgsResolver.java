package com.typegraph.schema.fixtures;

import com.typegraph.schema.annotations.Arg;
import com.typegraph.schema.annotations.Args;
import com.typegraph.schema.annotations.Query;
import com.typegraph.schema.annotations.Resolver;

@Resolver
public class MixedArgsResolver {

    @Query
    public User find(@Arg("id") int id, @Args UserInput filter) {
        return null;
    }
}
