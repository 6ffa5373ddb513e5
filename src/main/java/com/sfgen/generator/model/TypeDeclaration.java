package com.sfgen.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A package-level {@code type} declaration.
 *
 * Struct declarations carry their fields and no underlying type; every
 * other declaration carries the type it is defined as (or aliases).
 */
@Value
@Builder(toBuilder = true)
public class TypeDeclaration {

    @NonNull
    String name;

    @Singular
    List<String> typeParameters;

    boolean alias;

    TypeExpr underlying;

    List<StructField> fields;

    String sourceFile;

    int sourceLine;

    public boolean isStruct() {
        return fields != null;
    }
}
