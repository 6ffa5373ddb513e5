package com.sfgen.generator.codegen.exception;

/**
 * A requested struct, or one of its fields, could not be resolved.
 */
public class ResolutionException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        NOT_FOUND,
        NOT_A_RECORD,
        MALFORMED_METADATA,
        INVALID_CAPTURE_EXPRESSION,
        FOREIGN_EMBEDDING
    }

    private final Reason reason;

    public ResolutionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ResolutionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
