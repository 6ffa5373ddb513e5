package com.sfgen.generator.codegen.model;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Generated code for one output file, before it is wrapped into a full
 * source file.
 */
@Value
@Builder
public class GenerationResult {

    @NonNull
    Path outputTarget;

    @NonNull
    String outputPackage;

    @NonNull
    String textFragment;

    @Singular
    List<ImportReference> requiredReferences;

    int constantCount;
}
