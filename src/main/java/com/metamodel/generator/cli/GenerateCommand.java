package com.metamodel.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metamodel.generator.cli.exception.OptionsValidationException;
import com.metamodel.generator.cli.model.GenerateOptions;
import com.metamodel.generator.cli.model.ValidatedGenerateOptions;
import com.metamodel.generator.cli.output.GenerateResultsPrinter;
import com.metamodel.generator.cli.validation.GenerateOptionsValidator;
import com.metamodel.generator.codegen.GeneratorConfig;
import com.metamodel.generator.codegen.GeneratorResult;
import com.metamodel.generator.codegen.ProjectGenerator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command generating Java types and their JSON codec from a meta-model.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "metamodel-codegen 1.0.0",
        description = "Generates Java types with JSON de/serialization from a meta-model."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return 1;
        }

        printer.printBanner(options, validated);

        GeneratorConfig config = GeneratorConfig.builder()
                .projectName(options.getProjectName())
                .schemaFile(options.getSchemaFile())
                .packageName(options.getPackageName())
                .snippetsDir(options.getSnippetsDir())
                .outputDir(validated.getNormalizedOutputDir())
                .force(options.isForce())
                .build();

        GeneratorResult result = new ProjectGenerator(config).generate();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }

        printer.printSuccess(validated, result);
        return 0;
    }
}
