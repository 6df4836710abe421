package com.metamodel.generator.codegen.template;

import java.io.IOException;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.metamodel.generator.codegen.jsonization.ReportingGenerator;
import com.metamodel.generator.codegen.model.output.GeneratedFile;

import static org.assertj.core.api.Assertions.*;

class TemplateRendererTest {

    private final TemplateRenderer renderer = new TemplateRenderer();

    @Test
    void testRendersReportingIntoPackage() throws Exception {
        GeneratedFile reporting = new ReportingGenerator(renderer).generate("com.example.drawing");

        assertThat(reporting.getRelativePath()).isEqualTo("src/main/java/com/example/drawing/Reporting.java");
        assertThat(reporting.getContents())
                .contains("package com.example.drawing;")
                .contains("public final class Reporting {")
                .doesNotContain("${");
    }

    @Test
    void testMissingTemplateIsAnIoError() {
        assertThatThrownBy(() -> renderer.render("java/Missing.java.ftl", Map.of()))
                .isInstanceOf(IOException.class);
    }

    @Test
    void testMissingVariableFailsRendering() {
        assertThatThrownBy(() -> renderer.render("java/Reporting.java.ftl", Map.of()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Failed to render template java/Reporting.java.ftl");
    }
}
