package com.typegraph.schema.fixtures;

import com.typegraph.schema.annotations.Arg;
import com.typegraph.schema.annotations.Query;
import com.typegraph.schema.annotations.Resolver;

@Resolver(User.class)
public class UserResolver {

    @Query
    public User getUser(@Arg("id") int id) {
        return new User();
    }

    public String notAQuery() {
        return "";
    }
}
