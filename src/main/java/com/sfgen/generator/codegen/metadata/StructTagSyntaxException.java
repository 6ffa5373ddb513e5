package com.sfgen.generator.codegen.metadata;

/**
 * Raised for a struct tag that does not follow the {@code key:"value"}
 * convention.
 */
public class StructTagSyntaxException extends Exception {

    private static final long serialVersionUID = 1L;

    public StructTagSyntaxException(String message) {
        super(message);
    }
}
