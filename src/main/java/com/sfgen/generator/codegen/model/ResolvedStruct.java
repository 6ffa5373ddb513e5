package com.sfgen.generator.codegen.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * The flattened, ordered field list of one struct.
 */
@Value
@Builder
public class ResolvedStruct {

    @NonNull
    String recordName;

    @NonNull
    String baseTypeName;

    @Singular
    List<ResolvedField> fields;

    public List<String> constantValues() {
        return fields.stream().map(ResolvedField::getConstantValue).toList();
    }
}
