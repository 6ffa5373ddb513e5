package com.sfgen.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * The declarations of one Go source file that matter for generation.
 */
@Value
@Builder(toBuilder = true)
public class GoSourceFile {

    @NonNull
    String fileName;

    @NonNull
    String packageName;

    /**
     * Import path of the package this file belongs to.
     */
    @NonNull
    String importPath;

    @Singular("goImport")
    List<GoImport> imports;

    @Singular
    List<TypeDeclaration> typeDeclarations;

    /**
     * Set when the file's build constraints exclude it on the target platform.
     */
    boolean buildIgnored;

    public boolean isTestFile() {
        return fileName.endsWith("_test.go");
    }
}
