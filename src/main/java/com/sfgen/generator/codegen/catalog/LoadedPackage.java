package com.sfgen.generator.codegen.catalog;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.sfgen.generator.codegen.model.SourceLocation;
import com.sfgen.generator.model.TypeDeclaration;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Symbol table of one loaded Go package.
 */
@Value
@Builder
public class LoadedPackage {

    @NonNull
    SourceLocation location;

    @NonNull
    String packageName;

    @NonNull
    String importPath;

    @Singular
    Map<String, TypeDeclaration> declarations;

    @Singular
    List<String> fileNames;

    public Optional<TypeDeclaration> lookup(String typeName) {
        return Optional.ofNullable(declarations.get(typeName));
    }

    public String describe() {
        return location.getDirectory() + "#" + packageName;
    }
}
