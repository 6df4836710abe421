package com.metamodel.generator.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metamodel.generator.cli.model.GenerateOptions;
import com.metamodel.generator.cli.model.ValidatedGenerateOptions;
import com.metamodel.generator.codegen.GeneratorResult;
import com.metamodel.generator.common.GenerationError;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Meta-model Code Generator");
        log.info("=================================================");
        log.info("Schema: {}", o.getSchemaFile().toAbsolutePath());
        log.info("Package: {}", o.getPackageName());
        log.info("Snippets: {}", o.getSnippetsDir() != null ? o.getSnippetsDir().toAbsolutePath() : "None");
        log.info("Project Name: {}", o.getProjectName());
        log.info("Output Directory: {}", v.getProjectPath());
        log.info("=================================================");
    }

    public void printSuccess(ValidatedGenerateOptions v, GeneratorResult result) {
        Path projectPath = v.getProjectPath();

        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", projectPath);
        log.info("Enumerations: {}", result.getEnumerationCount());
        log.info("Constrained Primitives: {}", result.getConstrainedPrimitiveCount());
        log.info("Classes: {}", result.getClassCount());
        log.info("Interfaces: {}", result.getInterfaceCount());
        log.info("Files Written: {}", result.getFilesWritten());
        log.info("");
        log.info("Build the generated project:");
        log.info("   cd {}", projectPath);
        log.info("   mvn clean package");
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
        for (GenerationError error : result.getErrors()) {
            log.error("  {}", error);
        }
    }
}
