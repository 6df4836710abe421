package com.metamodel.generator.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--schema", "-s" }, required = true, description = "JSON file with the meta-model")
	private Path schemaFile;

	@Option(names = { "--package", "-p" }, required = true, description = "Java package of the generated code")
	private String packageName;

	@Option(names = { "--snippets" }, description = "Directory with hand-written snippets for implementation-specific classes")
	private Path snippetsDir;

	@Option(names = { "--project-name", "-n" }, defaultValue = "metamodel", description = "Name of the generated project")
	private String projectName;

	@Option(names = { "--output-dir", "-o" }, description = "Output directory (defaults to current directory)")
	private Path outputDir;

	@Option(names = { "--force", "-f" }, description = "Overwrite existing output directory")
	private boolean force;

	// ---- Getters (no setters needed; picocli sets fields reflectively) ----

}
