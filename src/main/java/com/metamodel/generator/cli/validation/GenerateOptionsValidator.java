package com.metamodel.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.metamodel.generator.cli.exception.OptionsValidationException;
import com.metamodel.generator.cli.model.GenerateOptions;
import com.metamodel.generator.cli.model.ValidatedGenerateOptions;
import com.metamodel.generator.codegen.naming.JavaNaming;

public class GenerateOptionsValidator {

	private static final Pattern PACKAGE_SEGMENT = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getSchemaFile() == null) {
			errors.add("Schema file is required (--schema / -s).");
		} else if (!Files.isRegularFile(o.getSchemaFile())) {
			errors.add("Schema file does not exist or is not a file: " + o.getSchemaFile());
		}

		if (isBlank(o.getPackageName())) {
			errors.add("Package is required (--package / -p).");
		} else if (!isValidPackage(o.getPackageName())) {
			errors.add("Not a valid Java package: " + o.getPackageName());
		}

		if (o.getSnippetsDir() != null && !existsDirectory(o.getSnippetsDir())) {
			errors.add("Snippets directory does not exist or is not a directory: " + o.getSnippetsDir());
		}

		if (isBlank(o.getProjectName())) {
			errors.add("Project name must not be blank (--project-name / -n).");
		}

		// Normalize output dir and compute project path
		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();

		Path projectPath = normalizedOutputDir.resolve(o.getProjectName() == null ? "" : o.getProjectName())
				.normalize();

		if (Files.exists(projectPath) && !o.isForce()) {
			errors.add("Output directory already exists: " + projectPath + ". Use --force to overwrite.");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(normalizedOutputDir, projectPath);
	}

	static boolean isValidPackage(String packageName) {
		for (String segment : packageName.split("\\.", -1)) {
			if (!PACKAGE_SEGMENT.matcher(segment).matches() || JavaNaming.isKeyword(segment)) {
				return false;
			}
		}
		return true;
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
