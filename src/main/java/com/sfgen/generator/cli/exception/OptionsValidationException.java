package com.sfgen.generator.cli.exception;

import java.util.List;

import com.sfgen.generator.codegen.exception.ConfigurationException;

/**
 * Every option error of one invocation, reported together.
 */
public class OptionsValidationException extends ConfigurationException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super(String.join(System.lineSeparator(), errors));
		if (errors.isEmpty()) {
			throw new IllegalArgumentException("at least one error is required");
		}
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}
}
