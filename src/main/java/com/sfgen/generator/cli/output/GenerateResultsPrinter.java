package com.sfgen.generator.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sfgen.generator.cli.model.ValidatedGenerateOptions;
import com.sfgen.generator.codegen.GeneratorResult;
import com.sfgen.generator.codegen.model.GenerationRequest;

/**
 * Responsible only for printing CLI output for the generate command.
 * No validation, no execution.
 *
 * Everything goes to the log, which is kept off standard output so dry-run
 * output can be piped.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(ValidatedGenerateOptions v) {
        log.debug("=================================================");
        log.debug("sfgen: struct field constant generator");
        log.debug("=================================================");
        for (GenerationRequest request : v.getRequests()) {
            log.debug("Struct: {} ({})", request.getRecordName(), request.getSourceLocation());
            log.debug("  Tag: {}", request.getMetadataKey() != null ? request.getMetadataKey() : "None");
            log.debug("  Style: {}", request.getStyle());
            log.debug("  Output: {} (package {})", request.getOutputTarget(), request.getOutputPackage());
        }
        log.debug("Dry run: {}", v.isDryRun());
        log.debug("=================================================");
    }

    public void printSuccess(GeneratorResult result, boolean dryRun) {
        log.info("Generated {} constant(s) into {} file(s) from {} package(s){}",
                result.getConstantsGenerated(), result.getFilesGenerated(), result.getPackagesLoaded(),
                dryRun ? " (dry run)" : "");
        for (Path file : result.getOutputFiles()) {
            log.debug("  {}", file);
        }
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
    }
}
