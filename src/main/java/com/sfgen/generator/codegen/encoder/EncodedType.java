package com.sfgen.generator.codegen.encoder;

import java.util.List;

import com.sfgen.generator.codegen.model.ImportReference;

import lombok.NonNull;
import lombok.Value;

/**
 * Source text of a type plus the imports that text depends on.
 */
@Value
public class EncodedType {

    @NonNull
    String text;

    @NonNull
    List<ImportReference> references;
}
