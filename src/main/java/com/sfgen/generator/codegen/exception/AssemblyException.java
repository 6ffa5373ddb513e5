package com.sfgen.generator.codegen.exception;

/**
 * Requests cannot be combined into output files as asked.
 */
public class AssemblyException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        CONFLICTING_PACKAGE,
        INCOMPATIBLE_STYLE,
        GROUP_FAILED
    }

    private final Reason reason;

    public AssemblyException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AssemblyException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
