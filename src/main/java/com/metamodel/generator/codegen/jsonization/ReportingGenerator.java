package com.metamodel.generator.codegen.jsonization;

import java.io.IOException;
import java.util.Map;

import com.metamodel.generator.codegen.model.output.GeneratedFile;
import com.metamodel.generator.codegen.template.TemplateRenderer;

/**
 * Generates {@code Reporting.java}: path segments, errors with a path, the
 * two-case result and the JSON path rendering.
 *
 * The file does not depend on the meta-model, only on the target package.
 */
public class ReportingGenerator {

    static final String TEMPLATE = "java/Reporting.java.ftl";

    private final TemplateRenderer renderer;

    public ReportingGenerator(TemplateRenderer renderer) {
        this.renderer = renderer;
    }

    public GeneratedFile generate(String packageName) throws IOException {
        String contents = renderer.render(TEMPLATE, Map.of("packageName", packageName));
        return GeneratedFile.java(packageName, "Reporting", contents);
    }
}
