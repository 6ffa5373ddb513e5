package com.sfgen.generator.codegen;

import java.io.PrintStream;
import java.util.List;

import com.sfgen.generator.codegen.model.GenerationRequest;
import com.sfgen.generator.codegen.model.GoGenerateEnvironment;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Configuration for one generator run.
 */
@Data
@Builder
public class GeneratorConfig {

    @Singular
    private List<GenerationRequest> requests;

    /**
     * Print generated files instead of writing them.
     */
    private boolean dryRun;

    @Builder.Default
    private GoGenerateEnvironment environment = GoGenerateEnvironment.builder().build();

    @Builder.Default
    private int parallelism = Runtime.getRuntime().availableProcessors();

    @Builder.Default
    private PrintStream dryRunOutput = System.out;
}
