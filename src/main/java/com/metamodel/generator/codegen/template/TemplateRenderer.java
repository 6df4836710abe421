package com.metamodel.generator.codegen.template;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the FreeMarker templates bundled under {@code /templates}.
 */
public class TemplateRenderer {

    private final Configuration freemarkerConfig;

    public TemplateRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * @param templateName path below {@code /templates}, e.g. {@code java/Reporting.java.ftl}
     * @throws IOException if the template is missing or fails to render
     */
    public String render(String templateName, Map<String, ?> dataModel) throws IOException {
        Template template = freemarkerConfig.getTemplate(templateName);
        StringWriter out = new StringWriter();
        try {
            template.process(dataModel, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render template " + templateName + ": " + e.getMessage(), e);
        }
        return out.toString();
    }
}
