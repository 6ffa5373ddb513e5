package com.sfgen.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a generator run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;

    private int packagesLoaded;
    private int filesGenerated;
    private int constantsGenerated;
    private List<Path> outputFiles;

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .outputFiles(List.of())
                .build();
    }
}
