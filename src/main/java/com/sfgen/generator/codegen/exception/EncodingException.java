package com.sfgen.generator.codegen.exception;

/**
 * A field type has a shape the generator cannot write out.
 */
public class EncodingException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
