package com.metamodel.generator.schema;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.metamodel.generator.TestSchemas;
import com.metamodel.generator.common.GenerationError;
import com.metamodel.generator.common.GenerationOutcome;
import com.metamodel.generator.model.Argument;
import com.metamodel.generator.model.ClassDefinition;
import com.metamodel.generator.model.ConcreteClass;
import com.metamodel.generator.model.Enumeration;
import com.metamodel.generator.model.Property;
import com.metamodel.generator.model.SymbolTable;

import static org.assertj.core.api.Assertions.*;

class SchemaLoaderTest {

    private final SchemaLoader loader = new SchemaLoader();

    private SymbolTable loadDrawing() {
        GenerationOutcome<SymbolTable> outcome = loader.load(TestSchemas.drawingSchemaPath());
        assertThat(outcome.getErrors()).isEmpty();
        return outcome.getValue();
    }

    private ClassDefinition findClass(SymbolTable table, String name) {
        return (ClassDefinition) table.find(name).orElseThrow();
    }

    @Test
    void testLoadKeepsDeclarationOrder() {
        SymbolTable table = loadDrawing();

        assertThat(table.getOurTypes()).extracting("name").containsExactly(
                "Color", "Non_empty_string", "Shape", "Circle", "Labeled_circle",
                "Polygon", "Point", "Opaque", "Drawing");
        Enumeration color = table.getEnumerations().get(0);
        assertThat(color.getLiterals()).extracting("value").containsExactly("Red", "Green", "Light blue");
    }

    @Test
    void testInheritedPropertiesComeFirst() {
        SymbolTable table = loadDrawing();

        ClassDefinition labeledCircle = findClass(table, "Labeled_circle");
        assertThat(labeledCircle.getProperties()).extracting(Property::getName)
                .containsExactly("id", "color", "radius", "label");
        assertThat(labeledCircle.getProperties().get(0).getDeclaringClass()).isEqualTo("Shape");
        assertThat(labeledCircle.getConstructorArguments()).extracting(Argument::getName)
                .containsExactly("id", "color", "radius", "label");
    }

    @Test
    void testDeclaredConstructorTakesTypesAndDefaults() {
        SymbolTable table = loadDrawing();

        ClassDefinition polygon = findClass(table, "Polygon");
        assertThat(polygon.getConstructorArguments()).extracting(Argument::getName)
                .containsExactly("id", "vertices", "color", "tags", "closed");
        Argument closed = polygon.getConstructorArguments().get(4);
        assertThat(closed.getTypeAnnotation().toSchemaString()).isEqualTo("Optional[bool]");
        assertThat(closed.getDefault()).hasValueSatisfying(value -> assertThat(value.getValue()).isEqualTo(true));
        assertThat(closed.isRequired()).isFalse();
    }

    @Test
    void testInterfacesAreSynthesizedForClassesWithDescendants() {
        SymbolTable table = loadDrawing();

        ClassDefinition shape = findClass(table, "Shape");
        assertThat(shape.getInterface()).isPresent();
        assertThat(shape.getInterface().get().getImplementers()).extracting(ConcreteClass::getName)
                .containsExactly("Circle", "Labeled_circle", "Polygon");

        ClassDefinition circle = findClass(table, "Circle");
        assertThat(circle.getInterface()).isPresent();
        assertThat(circle.getInterface().get().getImplementers()).extracting(ConcreteClass::getName)
                .containsExactly("Circle", "Labeled_circle");

        assertThat(findClass(table, "Point").getInterface()).isEmpty();
        assertThat(table.getInterfaces()).hasSize(2);
    }

    @Test
    void testModelTypeIsSerializedWithinHierarchies() {
        SymbolTable table = loadDrawing();

        assertThat(findClass(table, "Circle").isWithModelType()).isTrue();
        assertThat(findClass(table, "Labeled_circle").isWithModelType()).isTrue();
        assertThat(findClass(table, "Polygon").isWithModelType()).isTrue();
        assertThat(findClass(table, "Point").isWithModelType()).isFalse();
        assertThat(findClass(table, "Drawing").isWithModelType()).isFalse();
    }

    @Test
    void testCollectsAllLoadErrors() {
        String json = """
                {"types": [
                  {"kind": "concrete_class", "name": "A",
                   "properties": [{"name": "b", "type": "Missing"}, {"name": "c", "type": "List[Other]"}]},
                  {"kind": "enumeration", "name": "A", "literals": []}
                ]}
                """;

        GenerationOutcome<SymbolTable> outcome = loader.load(json);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getErrors()).extracting(GenerationError::getMessage)
                .anyMatch(message -> message.contains("defined more than once"))
                .anyMatch(message -> message.contains("undefined type: Missing"))
                .anyMatch(message -> message.contains("undefined type: Other"));
    }

    @Test
    void testReportsMissingListOfTypes() {
        GenerationOutcome<SymbolTable> outcome = loader.load("""
                {"types": null}
                """);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getErrors()).extracting(GenerationError::getMessage)
                .containsExactly("The list of types is missing");
    }

    @Test
    void testReportsNullListsAndEntries() {
        String json = """
                {"types": [
                  null,
                  {"kind": "enumeration", "name": "E", "literals": null},
                  {"kind": "concrete_class", "name": "A", "properties": null},
                  {"kind": "concrete_class", "name": "B", "properties": [null]},
                  {"kind": "concrete_class", "name": "C", "constructor": [null]}
                ]}
                """;

        GenerationOutcome<SymbolTable> outcome = loader.load(json);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getErrors()).extracting(GenerationError::getSubject)
                .containsExactly("types[0]", "E", "A", "B", "C");
        assertThat(outcome.getErrors()).extracting(GenerationError::getMessage)
                .containsExactly(
                        "The type definition is null",
                        "The literals must be a list, but got null",
                        "The properties must be a list, but got null",
                        "The entry 0 of the properties is null",
                        "The entry 0 of the constructor arguments is null");
    }

    @Test
    void testRejectsInheritanceCycle() {
        String json = """
                {"types": [
                  {"kind": "concrete_class", "name": "A", "inheritances": ["B"]},
                  {"kind": "concrete_class", "name": "B", "inheritances": ["A"]}
                ]}
                """;

        GenerationOutcome<SymbolTable> outcome = loader.load(json);

        assertThat(outcome.getErrors()).extracting(GenerationError::getMessage)
                .contains("The class inherits from itself");
    }

    @Test
    void testRejectsInvalidSyntaxAndKinds() {
        String json = """
                {"types": [
                  {"kind": "concrete_class", "name": "A", "properties": [{"name": "b", "type": "List[int"}]},
                  {"kind": "table", "name": "T"},
                  {"kind": "constrained_primitive", "name": "C", "constrainee": "decimal"}
                ]}
                """;

        GenerationOutcome<SymbolTable> outcome = loader.load(json);

        List<GenerationError> errors = outcome.getErrors();
        assertThat(errors).hasSize(3);
        assertThat(errors).extracting(GenerationError::getSubject).containsExactly("A", "T", "C");
    }

    @Test
    void testReportsUnreadableFile(@TempDir Path tempDir) {
        GenerationOutcome<SymbolTable> outcome = loader.load(tempDir.resolve("missing.json"));

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getErrors()).hasSize(1);
    }
}
