package com.sfgen.generator.codegen.exception;

/**
 * Base type of every error that aborts a generation run.
 */
public abstract class GenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected GenerationException(String message) {
        super(message);
    }

    protected GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
