package com.metamodel.generator.codegen.doc;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.metamodel.generator.codegen.model.output.GeneratedFile;
import com.metamodel.generator.codegen.model.output.GeneratedFileType;
import com.metamodel.generator.codegen.naming.JavaNaming;
import com.metamodel.generator.codegen.naming.JsonNaming;
import com.metamodel.generator.codegen.template.TemplateRenderer;
import com.metamodel.generator.model.ClassDefinition;
import com.metamodel.generator.model.ConcreteClass;
import com.metamodel.generator.model.ConstrainedPrimitive;
import com.metamodel.generator.model.Enumeration;
import com.metamodel.generator.model.EnumerationLiteral;
import com.metamodel.generator.model.Property;
import com.metamodel.generator.model.SymbolTable;

/**
 * Generates {@code API.md}, the reference of the JSON format of the meta-model.
 */
public class DocumentationGenerator {

    static final String TEMPLATE = "api-doc.md.ftl";

    private final TemplateRenderer renderer;

    public DocumentationGenerator(TemplateRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * @throws IOException if the template fails to render
     */
    public GeneratedFile generate(SymbolTable symbolTable, String projectName, String packageName)
            throws IOException {
        Map<String, Object> dataModel = new LinkedHashMap<>();
        dataModel.put("projectName", projectName);
        dataModel.put("packageName", packageName);
        dataModel.put("modelTypeKey", JsonNaming.MODEL_TYPE_KEY);
        dataModel.put("enumerations", symbolTable.getEnumerations().stream().map(this::enumerationModel).toList());
        dataModel.put("constrainedPrimitives",
                symbolTable.getConstrainedPrimitives().stream().map(this::constrainedPrimitiveModel).toList());
        dataModel.put("classes", symbolTable.getClasses().stream().map(this::classModel).toList());

        return GeneratedFile.builder()
                .relativePath("API.md")
                .contents(renderer.render(TEMPLATE, dataModel))
                .type(GeneratedFileType.DOCUMENTATION)
                .build();
    }

    private Map<String, Object> enumerationModel(Enumeration enumeration) {
        List<Map<String, Object>> literals = new ArrayList<>();
        for (EnumerationLiteral literal : enumeration.getLiterals()) {
            literals.add(Map.of(
                    "javaName", JavaNaming.enumLiteralName(literal.getName()),
                    "value", literal.getValue()));
        }
        return Map.of(
                "javaName", JavaNaming.enumName(enumeration.getName()),
                "description", text(enumeration.getDescription()),
                "literals", literals);
    }

    private Map<String, Object> constrainedPrimitiveModel(ConstrainedPrimitive primitive) {
        return Map.of(
                "name", primitive.getName(),
                "constrainee", primitive.getConstrainee().getSchemaName());
    }

    private Map<String, Object> classModel(ClassDefinition cls) {
        List<Map<String, Object>> properties = new ArrayList<>();
        for (Property property : cls.getProperties()) {
            properties.add(Map.of(
                    "jsonName", JsonNaming.propertyName(property.getName()),
                    "type", property.getTypeAnnotation().toSchemaString(),
                    "required", !property.getTypeAnnotation().isOptional(),
                    "description", text(property.getDescription()).replace("\n", " ").replace("|", "\\|")));
        }

        List<String> implementers = cls.getInterface()
                .map(iface -> iface.getImplementers().stream()
                        .map(implementer -> JavaNaming.className(implementer.getName()))
                        .toList())
                .orElse(List.of());

        boolean concrete = cls instanceof ConcreteClass;
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("name", cls.getName());
        model.put("abstract", cls.isAbstract());
        model.put("description", text(cls.getDescription()));
        model.put("javaName", concrete ? JavaNaming.className(cls.getName()) : "");
        model.put("interfaceName", cls.getInterface().isPresent() ? JavaNaming.interfaceName(cls.getName()) : "");
        model.put("implementers", implementers);
        model.put("modelType", concrete && cls.isWithModelType() ? JsonNaming.modelType(cls.getName()) : "");
        model.put("implementationSpecific", concrete && ((ConcreteClass) cls).isImplementationSpecific());
        model.put("properties", properties);
        return model;
    }

    private static String text(String description) {
        return description == null ? "" : description.strip();
    }
}
