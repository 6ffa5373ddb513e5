package com.sfgen.generator.codegen.assembler;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sfgen.generator.codegen.exception.AssemblyException;
import com.sfgen.generator.codegen.exception.AssemblyException.Reason;
import com.sfgen.generator.codegen.model.ConstantStyle;
import com.sfgen.generator.codegen.model.GenerationRequest;
import com.sfgen.generator.codegen.model.GenerationResult;
import com.sfgen.generator.codegen.model.ImportReference;
import com.sfgen.generator.codegen.model.ResolvedField;
import com.sfgen.generator.codegen.model.ResolvedStruct;
import com.sfgen.generator.codegen.resolver.StructResolver;
import com.sfgen.generator.codegen.util.FailFastTasks;

/**
 * Groups requests by output file and generates each group's code.
 *
 * Requests are validated as a whole before anything is resolved. Groups are
 * generated concurrently; results come back in the order each output file
 * was first requested.
 */
public class OutputAssembler {
    private static final Logger log = LoggerFactory.getLogger(OutputAssembler.class);

    private final StructResolver resolver;
    private final FragmentRenderer renderer;
    private final int parallelism;

    public OutputAssembler(StructResolver resolver, FragmentRenderer renderer, int parallelism) {
        this.resolver = resolver;
        this.renderer = renderer;
        this.parallelism = parallelism;
    }

    public Map<Path, GenerationResult> assemble(List<GenerationRequest> requests) {
        requests.forEach(OutputAssembler::checkStyle);
        Map<Path, List<GenerationRequest>> groups = groupByOutputTarget(requests);

        Map<Path, Callable<GenerationResult>> tasks = new LinkedHashMap<>();
        groups.forEach((target, group) -> tasks.put(target, () -> generateGroup(target, group)));
        log.debug("Generating {} output file(s) from {} request(s)", groups.size(), requests.size());

        try {
            return FailFastTasks.runAll(tasks, parallelism, OutputAssembler::groupFailure);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssemblyException(Reason.GROUP_FAILED, "interrupted while generating output", e);
        }
    }

    static AssemblyException groupFailure(Path target, Throwable cause) {
        return new AssemblyException(Reason.GROUP_FAILED, "failed to generate " + target + ": " + cause.getMessage(),
                cause);
    }

    static void checkStyle(GenerationRequest request) {
        if (request.getNamingOptions().isEnumerationHelperRequested() && !request.getStyle().isNominal()) {
            String style = request.getStyle() == ConstantStyle.NONE
                    ? "none"
                    : request.getStyle().getFlagValue();
            throw new AssemblyException(Reason.INCOMPATIBLE_STYLE, String.format(
                    "invalid style %s for %s: only %s and %s styles may be used with the enumeration helper",
                    style, request.describe(), ConstantStyle.GENERIC.getFlagValue(),
                    ConstantStyle.TYPED.getFlagValue()));
        }
    }

    static Map<Path, List<GenerationRequest>> groupByOutputTarget(List<GenerationRequest> requests) {
        Map<Path, List<GenerationRequest>> groups = new LinkedHashMap<>();
        for (GenerationRequest request : requests) {
            Path target = request.getOutputTarget().toAbsolutePath().normalize();
            List<GenerationRequest> group = groups.computeIfAbsent(target, t -> new ArrayList<>());
            if (!group.isEmpty() && !group.get(0).getOutputPackage().equals(request.getOutputPackage())) {
                throw new AssemblyException(Reason.CONFLICTING_PACKAGE, String.format(
                        "invalid package values provided. Cannot use both %s and %s package values within output file %s",
                        group.get(0).getOutputPackage(), request.getOutputPackage(), target));
            }
            group.add(request);
        }
        return groups;
    }

    private GenerationResult generateGroup(Path target, List<GenerationRequest> group) {
        List<String> fragments = new ArrayList<>();
        Map<String, ImportReference> references = new LinkedHashMap<>();
        int constantCount = 0;

        for (GenerationRequest request : group) {
            ResolvedStruct resolved = resolver.resolve(request);
            fragments.add(renderer.render(request, resolved));
            constantCount += resolved.getFields().size();
            // Field types only appear in the output for the generic style.
            if (request.getStyle() == ConstantStyle.GENERIC) {
                for (ResolvedField field : resolved.getFields()) {
                    field.getRequiredReferences().forEach(reference -> references.putIfAbsent(reference.path(), reference));
                }
            }
        }

        log.debug("Generated {} constant(s) for {}", constantCount, target);
        return GenerationResult.builder()
                .outputTarget(target)
                .outputPackage(group.get(0).getOutputPackage())
                .textFragment(String.join("\n", fragments))
                .requiredReferences(references.values())
                .constantCount(constantCount)
                .build();
    }
}
