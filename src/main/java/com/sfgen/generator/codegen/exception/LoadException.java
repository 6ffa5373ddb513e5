package com.sfgen.generator.codegen.exception;

import com.sfgen.generator.codegen.model.SourceLocation;

/**
 * A source location could not be read, parsed, or narrowed down to exactly
 * one package.
 */
public class LoadException extends GenerationException {

    private static final long serialVersionUID = 1L;

    private final transient SourceLocation location;

    public LoadException(SourceLocation location, String message) {
        super("failed to load package " + location + ": " + message);
        this.location = location;
    }

    public LoadException(SourceLocation location, String message, Throwable cause) {
        super("failed to load package " + location + ": " + message, cause);
        this.location = location;
    }

    /**
     * For failures of the load phase as a whole rather than of one location.
     */
    public LoadException(String message, Throwable cause) {
        super(message, cause);
        this.location = null;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
