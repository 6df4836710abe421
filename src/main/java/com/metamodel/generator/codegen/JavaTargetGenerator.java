package com.metamodel.generator.codegen;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metamodel.generator.codegen.doc.DocumentationGenerator;
import com.metamodel.generator.codegen.jsonization.JsonizationGenerator;
import com.metamodel.generator.codegen.jsonization.ReportingGenerator;
import com.metamodel.generator.codegen.jsonization.TypeAnnotationResolver;
import com.metamodel.generator.codegen.model.output.GeneratedFile;
import com.metamodel.generator.codegen.project.PomGenerator;
import com.metamodel.generator.codegen.template.TemplateRenderer;
import com.metamodel.generator.codegen.types.StringificationGenerator;
import com.metamodel.generator.codegen.types.TypesGenerator;
import com.metamodel.generator.common.GenerationError;
import com.metamodel.generator.common.GenerationOutcome;
import com.metamodel.generator.model.SymbolTable;
import com.metamodel.generator.specific.SpecificImplementations;

/**
 * Generates a Maven project with the Java types of the meta-model and their
 * JSON codec on top of Jackson.
 */
public class JavaTargetGenerator implements TargetGenerator {
    private static final Logger log = LoggerFactory.getLogger(JavaTargetGenerator.class);

    private final TypesGenerator typesGenerator;
    private final StringificationGenerator stringificationGenerator;
    private final ReportingGenerator reportingGenerator;
    private final JsonizationGenerator jsonizationGenerator;
    private final DocumentationGenerator documentationGenerator;
    private final PomGenerator pomGenerator;

    public JavaTargetGenerator() {
        TemplateRenderer renderer = new TemplateRenderer();
        this.typesGenerator = new TypesGenerator();
        this.stringificationGenerator = new StringificationGenerator();
        this.reportingGenerator = new ReportingGenerator(renderer);
        this.jsonizationGenerator = new JsonizationGenerator(new TypeAnnotationResolver());
        this.documentationGenerator = new DocumentationGenerator(renderer);
        this.pomGenerator = new PomGenerator();
    }

    @Override
    public GenerationOutcome<List<GeneratedFile>> generate(SymbolTable symbolTable,
                                                           SpecificImplementations specifics,
                                                           GeneratorConfig config) throws IOException {
        String packageName = config.getPackageName();
        List<GeneratedFile> files = new ArrayList<>();
        List<GenerationError> errors = new ArrayList<>();

        log.info("Generating types...");
        GenerationOutcome<List<GeneratedFile>> types = typesGenerator.generate(symbolTable, specifics, packageName);
        if (types.isSuccess()) {
            files.addAll(types.getValue());
        } else {
            errors.addAll(types.getErrors());
        }
        files.add(stringificationGenerator.generate(symbolTable, packageName));

        log.info("Generating JSON de/serialization...");
        files.add(reportingGenerator.generate(packageName));
        GenerationOutcome<GeneratedFile> jsonization =
                jsonizationGenerator.generate(symbolTable, specifics, packageName);
        if (jsonization.isSuccess()) {
            files.add(jsonization.getValue());
        } else {
            errors.addAll(jsonization.getErrors());
        }

        log.info("Generating API.md and pom.xml...");
        files.add(documentationGenerator.generate(symbolTable, config.getProjectName(), packageName));
        files.add(pomGenerator.generate(config.getGroupId(), config.getArtifactId()));

        if (!errors.isEmpty()) {
            return GenerationOutcome.failure(errors);
        }
        return GenerationOutcome.success(files);
    }
}
