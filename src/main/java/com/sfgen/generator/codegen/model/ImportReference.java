package com.sfgen.generator.codegen.model;

import java.util.Objects;

/**
 * A package the generated code must import.
 *
 * @param path  import path
 * @param alias import name, {@code null} when the package's own name is used
 */
public record ImportReference(String path, String alias) {

    public ImportReference {
        Objects.requireNonNull(path, "path");
    }

    public static ImportReference of(String path) {
        return new ImportReference(path, null);
    }

    /**
     * Renders the import spec as it appears inside an import block.
     */
    public String toImportSpec() {
        return alias == null ? "\"" + path + "\"" : alias + " \"" + path + "\"";
    }
}
