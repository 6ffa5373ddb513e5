package com.sfgen.generator.cli.model;

import java.util.List;

import com.sfgen.generator.codegen.model.GenerationRequest;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    List<GenerationRequest> requests;
    boolean dryRun;
}
