package com.sfgen.generator.codegen.exception;

/**
 * Invalid or contradictory generation options, detected before anything is
 * loaded.
 */
public class ConfigurationException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
