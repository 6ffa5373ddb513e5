package com.sfgen.generator.codegen.model;

import java.nio.file.Path;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One unit of generation work: a struct to read and how to turn its fields
 * into constants. Immutable once built.
 */
@Value
@Builder(toBuilder = true)
public class GenerationRequest {

    @NonNull
    SourceLocation sourceLocation;

    /**
     * Struct to generate from. A {@code pkg.Name} form is accepted.
     */
    @NonNull
    String recordName;

    /**
     * Struct tag key whose value names each constant; {@code null} to use
     * field identifiers.
     */
    String metadataKey;

    /**
     * Regular expression applied to the tag value; its first capture group
     * becomes the constant value.
     */
    String metadataKeyCaptureExpression;

    @NonNull
    @Builder.Default
    NamingOptions namingOptions = NamingOptions.builder().build();

    @NonNull
    @Builder.Default
    ConstantStyle style = ConstantStyle.NONE;

    boolean includeUnexportedFields;

    /**
     * Absolute path of the file the generated code goes to.
     */
    @NonNull
    Path outputTarget;

    /**
     * Package clause name of the generated file.
     */
    @NonNull
    String outputPackage;

    /**
     * Import path of the generated file's package, when it could be derived.
     * Types owned by this package are written without a qualifier.
     */
    String outputImportPath;

    public String describe() {
        return recordName + " in " + sourceLocation;
    }
}
