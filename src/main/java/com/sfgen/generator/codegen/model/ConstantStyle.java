package com.sfgen.generator.codegen.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Shape of the type generated constants are declared with.
 */
public enum ConstantStyle {
    /** Untyped string constants, no type declaration. */
    NONE(""),
    /** {@code type X = string}. */
    ALIAS("alias"),
    /** {@code type X string} with a {@code String()} method. */
    TYPED("typed"),
    /** {@code type X[T any] string}, instantiated with each field's type. */
    GENERIC("generic");

    private final String flagValue;

    ConstantStyle(String flagValue) {
        this.flagValue = flagValue;
    }

    public String getFlagValue() {
        return flagValue;
    }

    /**
     * Whether the style declares a distinct named type that methods can be
     * attached to.
     */
    public boolean isNominal() {
        return this == TYPED || this == GENERIC;
    }

    public static Optional<ConstantStyle> fromFlagValue(String value) {
        String normalized = value == null ? "" : value.trim();
        return Arrays.stream(values())
                .filter(style -> style.flagValue.equals(normalized))
                .findFirst();
    }
}
