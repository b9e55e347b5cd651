package com.typegraph.schema.cli.exception;

/**
 * The schema report template failed to load or render.
 */
public class ReportRenderingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ReportRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
