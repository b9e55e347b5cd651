package com.typegraph.schema.metadata;

/**
 * Kind of a resolver method parameter.
 */
public enum ParamKind {
    /** One named argument bound directly to the parameter. */
    SINGLE_ARG,
    /** An input-shaped bag of arguments spread into the parameter. */
    SPREAD_ARGS,
    /** The execution context object. */
    CONTEXT,
    /** The field execution info. */
    INFO
}
