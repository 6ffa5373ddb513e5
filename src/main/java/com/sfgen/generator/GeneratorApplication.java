package com.sfgen.generator;

import com.sfgen.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point of sfgen, the Go struct field constant generator.
 * Usually run through a //go:generate directive next to the struct.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand())
                .execute(args);
        System.exit(exitCode);
    }
}
