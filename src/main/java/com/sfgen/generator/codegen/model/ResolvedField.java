package com.sfgen.generator.codegen.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A struct field after naming and type encoding.
 */
@Value
@Builder
public class ResolvedField {

    @NonNull
    String fieldIdentifier;

    @NonNull
    String constantName;

    @NonNull
    String constantValue;

    @NonNull
    String typeText;

    @Singular
    List<ImportReference> requiredReferences;
}
