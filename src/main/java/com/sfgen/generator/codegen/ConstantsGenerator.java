package com.sfgen.generator.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sfgen.generator.codegen.assembler.FragmentRenderer;
import com.sfgen.generator.codegen.assembler.OutputAssembler;
import com.sfgen.generator.codegen.catalog.PackageCatalog;
import com.sfgen.generator.codegen.catalog.PackageCatalogLoader;
import com.sfgen.generator.codegen.encoder.TypeExpressionEncoder;
import com.sfgen.generator.codegen.exception.GenerationException;
import com.sfgen.generator.codegen.model.GenerationRequest;
import com.sfgen.generator.codegen.model.GenerationResult;
import com.sfgen.generator.codegen.output.ArtifactWriter;
import com.sfgen.generator.codegen.output.GeneratedArtifactRenderer;
import com.sfgen.generator.codegen.resolver.StructResolver;

/**
 * Runs the whole pipeline: load packages, resolve and assemble, render, and
 * finally write every output file.
 *
 * Nothing is written unless every output file was generated.
 */
public class ConstantsGenerator {
    private static final Logger log = LoggerFactory.getLogger(ConstantsGenerator.class);

    private final GeneratorConfig config;
    private final GeneratedArtifactRenderer artifactRenderer;

    public ConstantsGenerator(GeneratorConfig config) {
        this.config = config;
        this.artifactRenderer = new GeneratedArtifactRenderer();
    }

    public GeneratorResult generate() {
        List<GenerationRequest> requests = config.getRequests();
        if (requests.isEmpty()) {
            return GeneratorResult.failure("No generation requests given");
        }

        try {
            log.info("Step 1: Loading source packages...");
            PackageCatalog catalog = new PackageCatalogLoader(config.getParallelism(), config.getEnvironment().buildContext())
                    .load(requests.stream().map(GenerationRequest::getSourceLocation).toList());
            log.info("Loaded {} package(s)", catalog.size());

            log.info("Step 2: Generating constants...");
            StructResolver resolver = new StructResolver(catalog, new TypeExpressionEncoder());
            OutputAssembler assembler = new OutputAssembler(resolver, new FragmentRenderer(), config.getParallelism());
            Map<Path, GenerationResult> results = assembler.assemble(requests);

            log.info("Step 3: Rendering {} file(s)...", results.size());
            Map<Path, String> artifacts = new LinkedHashMap<>();
            int constants = 0;
            for (GenerationResult result : results.values()) {
                artifacts.put(result.getOutputTarget(), artifactRenderer.render(result, config.getEnvironment()));
                constants += result.getConstantCount();
            }

            log.info("Step 4: {} file(s)...", config.isDryRun() ? "Printing" : "Writing");
            ArtifactWriter writer = new ArtifactWriter(config.isDryRun(), config.getDryRunOutput());
            List<Path> written = new ArrayList<>();
            for (Map.Entry<Path, String> artifact : artifacts.entrySet()) {
                writer.write(artifact.getKey(), artifact.getValue());
                written.add(artifact.getKey());
            }

            log.info("Generation complete!");
            return GeneratorResult.builder()
                    .success(true)
                    .packagesLoaded(catalog.size())
                    .filesGenerated(written.size())
                    .constantsGenerated(constants)
                    .outputFiles(written)
                    .build();

        } catch (GenerationException e) {
            // Reported by the caller; the stack is only of interest when debugging.
            log.debug("Generation failure detail", e);
            return GeneratorResult.failure(e.getMessage());
        } catch (IOException e) {
            log.warn("I/O failure during generation", e);
            return GeneratorResult.failure(e.getMessage());
        }
    }
}
