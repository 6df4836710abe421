package com.metamodel.generator;

import com.metamodel.generator.cli.GenerateCommand;

import picocli.CommandLine;

/**
 * Main entry point of the meta-model code generator.
 * Generates Java types of a meta-model together with their JSON de/serialization.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
