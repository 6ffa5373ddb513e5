package com.sfgen.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One field of a struct declaration, in source order.
 */
@Value
@Builder(toBuilder = true)
public class StructField {

    /**
     * Field identifier. For embedded fields this is the bare name of the
     * embedded type ({@code *pkg.Base[T]} gives {@code Base}).
     */
    @NonNull
    String name;

    @NonNull
    TypeExpr type;

    /**
     * Struct tag contents without the surrounding quotes; empty when absent.
     */
    @NonNull
    @Builder.Default
    String tag = "";

    boolean embedded;

    int sourceLine;

    public boolean isExported() {
        return !name.isEmpty() && Character.isUpperCase(name.codePointAt(0));
    }
}
