package com.sfgen.generator.cli;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sfgen.generator.cli.exception.OptionsValidationException;
import com.sfgen.generator.cli.model.GenerateOptions;
import com.sfgen.generator.cli.model.ValidatedGenerateOptions;
import com.sfgen.generator.cli.output.GenerateResultsPrinter;
import com.sfgen.generator.cli.util.ArgumentSplitter;
import com.sfgen.generator.cli.validation.GenerateOptionsValidator;
import com.sfgen.generator.codegen.ConstantsGenerator;
import com.sfgen.generator.codegen.GeneratorConfig;
import com.sfgen.generator.codegen.GeneratorResult;
import com.sfgen.generator.codegen.model.GoGenerateEnvironment;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Model.OptionSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * CLI command generating Go constants from struct fields.
 */
@Command(
        name = "sfgen",
        mixinStandardHelpOptions = true,
        version = "sfgen 1.0.0",
        description = "Generates constants from the fields of a Go struct. Meant to be run from //go:generate directives."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String GEN_OPTION = "--gen";

    @Mixin
    private GenerateOptions options;

    @Option(names = { GEN_OPTION, "-gen" },
            description = "Accepts all the other flags in a string, allowing multiple generate commands to be specified. "
                    + "Cannot be combined with other flags.")
    private List<String> genCommands = new ArrayList<>();

    @Spec
    private CommandSpec spec;

    private final GoGenerateEnvironment environment;
    private final PrintStream dryRunOutput;
    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    public GenerateCommand() {
        this(GoGenerateEnvironment.fromSystem(), System.out);
    }

    public GenerateCommand(GoGenerateEnvironment environment, PrintStream dryRunOutput) {
        this.environment = environment;
        this.dryRunOutput = dryRunOutput;
    }

    @Override
    public Integer call() {
        List<GenerateOptions> optionSets = collectOptionSets();

        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(optionSets, environment);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return EXIT_USAGE;
        } catch (UncheckedIOException e) {
            log.error("{}: {}", e.getMessage(), e.getCause().getMessage());
            return EXIT_FAILURE;
        }
        printer.printBanner(validated);

        try {
            GeneratorConfig config = GeneratorConfig.builder()
                    .requests(validated.getRequests())
                    .dryRun(validated.isDryRun())
                    .environment(environment)
                    .dryRunOutput(dryRunOutput)
                    .build();
            GeneratorResult result = new ConstantsGenerator(config).generate();
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return EXIT_FAILURE;
            }
            printer.printSuccess(result, validated.isDryRun());
            return EXIT_OK;
        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return EXIT_FAILURE;
        }
    }

    /**
     * The option sets to run: the command line itself, or one per
     * {@code --gen} string.
     *
     * @throws ParameterException when {@code --gen} is mixed with other
     *                            options or a {@code --gen} string does not parse
     */
    private List<GenerateOptions> collectOptionSets() {
        CommandLine commandLine = spec.commandLine();
        if (genCommands.isEmpty()) {
            return List.of(options);
        }

        boolean otherOptionsUsed = commandLine.getParseResult().matchedOptions().stream()
                .map(OptionSpec::longestName)
                .anyMatch(name -> !GEN_OPTION.equals(name));
        if (otherOptionsUsed) {
            throw new ParameterException(commandLine, "if --gen flags are used, only --gen flags may be provided");
        }

        List<GenerateOptions> optionSets = new ArrayList<>();
        for (String genCommand : genCommands) {
            optionSets.add(parseGenCommand(commandLine, genCommand));
        }
        return optionSets;
    }

    private static GenerateOptions parseGenCommand(CommandLine commandLine, String genCommand) {
        GenerateOptions genOptions = new GenerateOptions();
        try {
            List<String> args = ArgumentSplitter.split(genCommand.strip());
            new CommandLine(genOptions).parseArgs(args.toArray(String[]::new));
        } catch (IllegalArgumentException | ParameterException e) {
            throw new ParameterException(commandLine,
                    "failed to parse --gen \"" + genCommand + "\": " + e.getMessage(), e, null, genCommand);
        }
        return genOptions;
    }
}
