package com.metamodel.generator.codegen;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metamodel.generator.codegen.model.output.GeneratedFile;
import com.metamodel.generator.codegen.util.FileWriteUtil;
import com.metamodel.generator.common.GenerationError;
import com.metamodel.generator.common.GenerationOutcome;
import com.metamodel.generator.model.SymbolTable;
import com.metamodel.generator.schema.SchemaLoader;
import com.metamodel.generator.schema.SchemaVerifier;
import com.metamodel.generator.specific.SpecificImplementations;

/**
 * Main project generator: loads and verifies the meta-model, generates all the
 * files in memory and writes them only if no error was found.
 */
public class ProjectGenerator {
    private static final Logger log = LoggerFactory.getLogger(ProjectGenerator.class);

    private final GeneratorConfig config;
    private final SchemaLoader schemaLoader;
    private final SchemaVerifier schemaVerifier;
    private final TargetGenerator targetGenerator;

    public ProjectGenerator(GeneratorConfig config) {
        this(config, new SchemaLoader(), new SchemaVerifier(), new JavaTargetGenerator());
    }

    ProjectGenerator(GeneratorConfig config, SchemaLoader schemaLoader, SchemaVerifier schemaVerifier,
                     TargetGenerator targetGenerator) {
        this.config = config;
        this.schemaLoader = schemaLoader;
        this.schemaVerifier = schemaVerifier;
        this.targetGenerator = targetGenerator;
    }

    /**
     * Generate the complete project.
     */
    public GeneratorResult generate() {
        try {
            log.info("Starting project generation...");

            // Step 1: Load the meta-model
            log.info("Step 1: Loading schema {}...", config.getSchemaFile());
            GenerationOutcome<SymbolTable> loaded = schemaLoader.load(config.getSchemaFile());
            if (!loaded.isSuccess()) {
                return failure("The schema could not be loaded", loaded.getErrors());
            }
            SymbolTable symbolTable = loaded.getValue();

            // Step 2: Verify it
            log.info("Step 2: Verifying the meta-model...");
            List<GenerationError> verificationErrors = schemaVerifier.verify(symbolTable);
            if (!verificationErrors.isEmpty()) {
                return failure("The meta-model is not supported", verificationErrors);
            }

            // Step 3: Load the snippets
            SpecificImplementations specifics = SpecificImplementations.empty();
            if (config.getSnippetsDir() != null) {
                log.info("Step 3: Loading snippets from {}...", config.getSnippetsDir());
                specifics = SpecificImplementations.load(config.getSnippetsDir());
            } else {
                log.info("Step 3: No snippets directory given, skipping");
            }

            // Step 4: Generate in memory
            log.info("Step 4: Generating code...");
            GenerationOutcome<List<GeneratedFile>> generated =
                    targetGenerator.generate(symbolTable, specifics, config);
            if (!generated.isSuccess()) {
                return failure("The code could not be generated", generated.getErrors());
            }

            // Step 5: Write
            Path projectDir = config.getProjectDir();
            log.info("Step 5: Writing {} file(s) to {}...", generated.getValue().size(), projectDir);
            prepareProjectDir(projectDir);
            for (GeneratedFile file : generated.getValue()) {
                FileWriteUtil.safeWriteString(projectDir.resolve(file.getRelativePath()), file.getContents());
                log.debug("Wrote {} ({})", file.getRelativePath(), file.getType());
            }

            log.info("Project generation completed successfully!");
            return GeneratorResult.builder()
                    .success(true)
                    .outputPath(projectDir)
                    .enumerationCount(symbolTable.getEnumerations().size())
                    .constrainedPrimitiveCount(symbolTable.getConstrainedPrimitives().size())
                    .classCount(symbolTable.getClasses().size())
                    .interfaceCount(symbolTable.getInterfaces().size())
                    .filesWritten(generated.getValue().size())
                    .build();
        } catch (IOException e) {
            log.error("Generation failed with an I/O error", e);
            return GeneratorResult.failure("I/O error: " + e.getMessage());
        }
    }

    private void prepareProjectDir(Path projectDir) throws IOException {
        if (Files.exists(projectDir)) {
            if (!config.isForce()) {
                throw new IOException("Output directory already exists: " + projectDir);
            }
            log.warn("Force mode enabled, overwriting: {}", projectDir);
            FileWriteUtil.deleteDirectory(projectDir);
        }
        Files.createDirectories(projectDir);
    }

    private GeneratorResult failure(String message, List<GenerationError> errors) {
        log.error("{}; {} error(s):", message, errors.size());
        for (GenerationError error : errors) {
            log.error("  {}", error);
        }
        return GeneratorResult.failure(message, errors);
    }
}
