package com.metamodel.generator.schema;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.metamodel.generator.TestSchemas;
import com.metamodel.generator.common.GenerationError;
import com.metamodel.generator.common.GenerationOutcome;
import com.metamodel.generator.model.SymbolTable;

import static org.assertj.core.api.Assertions.*;

class SchemaVerifierTest {

    private final SchemaLoader loader = new SchemaLoader();
    private final SchemaVerifier verifier = new SchemaVerifier();

    private List<GenerationError> verify(String json) {
        GenerationOutcome<SymbolTable> outcome = loader.load(json);
        assertThat(outcome.getErrors()).isEmpty();
        return verifier.verify(outcome.getValue());
    }

    private static List<String> messages(List<GenerationError> errors) {
        return errors.stream().map(GenerationError::getMessage).toList();
    }

    @Test
    void testDrawingSchemaIsSupported() {
        assertThat(verifier.verify(TestSchemas.drawing())).isEmpty();
    }

    @Test
    void testRejectsReservedJavaName() {
        List<GenerationError> errors = verify("""
                {"types": [{"kind": "concrete_class", "name": "Transformer"}]}
                """);

        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).getSubject()).isEqualTo("Transformer");
        assertThat(errors.get(0).getMessage()).contains("reserved");
    }

    @Test
    void testRejectsNamesClashingWithPrimitiveParseRoutines() {
        List<GenerationError> errors = verify("""
                {"types": [
                  {"kind": "concrete_class", "name": "Bytes"},
                  {"kind": "enumeration", "name": "Bool", "literals": [{"name": "Yes"}]},
                  {"kind": "concrete_class", "name": "Byte_array"}
                ]}
                """);

        assertThat(messages(errors)).containsExactly(
                "The parse routine bytesFrom of the Java name Bytes clashes with the one of a primitive type",
                "The parse routine boolFrom of the Java name Bool clashes with the one of a primitive type");
        assertThat(errors).extracting(GenerationError::getSubject).containsExactly("Bytes", "Bool");
    }

    @Test
    void testRejectsClashingJavaNames() {
        List<GenerationError> errors = verify("""
                {"types": [
                  {"kind": "concrete_class", "name": "Some_thing"},
                  {"kind": "concrete_class", "name": "some_thing"}
                ]}
                """);

        assertThat(messages(errors)).containsExactly("The Java name SomeThing clashes with the one of Some_thing");
    }

    @Test
    void testRejectsPropertyWithoutArgument() {
        List<GenerationError> errors = verify("""
                {"types": [{"kind": "concrete_class", "name": "Point",
                  "properties": [{"name": "x", "type": "int"}, {"name": "y", "type": "int"}],
                  "constructor": [{"name": "x"}, {"name": "z", "type": "int"}]}]}
                """);

        assertThat(messages(errors)).containsExactlyInAnyOrder(
                "The property y is not initialized by a constructor argument",
                "The constructor argument z has no corresponding property");
    }

    @Test
    void testRejectsArgumentOfAnotherType() {
        List<GenerationError> errors = verify("""
                {"types": [{"kind": "concrete_class", "name": "Point",
                  "properties": [{"name": "x", "type": "int"}],
                  "constructor": [{"name": "x", "type": "Optional[int]"}]}]}
                """);

        assertThat(messages(errors)).containsExactly(
                "The constructor argument x is of type Optional[int], but the property is of type int");
    }

    @Test
    void testRejectsNestedLists() {
        List<GenerationError> errors = verify("""
                {"types": [{"kind": "concrete_class", "name": "Matrix",
                  "properties": [{"name": "rows", "type": "List[List[int]]"}]}]}
                """);

        // Reported once for the property and once for the derived argument.
        assertThat(errors).hasSize(2);
        assertThat(messages(errors)).allMatch(message -> message.startsWith("The type List[List[int]]"));
    }

    @Test
    void testRejectsDefaultOfRequiredArgument() {
        List<GenerationError> errors = verify("""
                {"types": [{"kind": "concrete_class", "name": "Point",
                  "properties": [{"name": "x", "type": "int"}],
                  "constructor": [{"name": "x", "default": 0}]}]}
                """);

        assertThat(messages(errors)).containsExactly("The constructor argument x is required and can not have a default");
    }

    @Test
    void testChecksDefaultAgainstType() {
        List<GenerationError> errors = verify("""
                {"types": [
                  {"kind": "enumeration", "name": "Color", "literals": [{"name": "red", "value": "Red"}]},
                  {"kind": "concrete_class", "name": "Pen",
                   "properties": [{"name": "width", "type": "Optional[int]"}, {"name": "color", "type": "Optional[Color]"}],
                   "constructor": [{"name": "width", "default": "thin"}, {"name": "color", "default": "blue"}]}
                ]}
                """);

        assertThat(errors).hasSize(2);
        assertThat(messages(errors).get(1)).isEqualTo("The default of the constructor argument color is not a literal of Color: blue");
    }

    @Test
    void testRejectsAbstractClassWithoutDescendants() {
        List<GenerationError> errors = verify("""
                {"types": [{"kind": "abstract_class", "name": "Lonely"}]}
                """);

        assertThat(messages(errors)).contains("The abstract class has no descendants and can not be instantiated");
    }

    @Test
    void testRejectsPropertyCollidingWithDiscriminator() {
        List<GenerationError> errors = verify("""
                {"types": [{"kind": "concrete_class", "name": "Thing",
                  "properties": [{"name": "model_type", "type": "str"}]}]}
                """);

        assertThat(messages(errors)).containsExactly("The property model_type collides with the discriminator modelType");
    }

    @Test
    void testRejectsGetterOfObject() {
        List<GenerationError> errors = verify("""
                {"types": [{"kind": "concrete_class", "name": "Thing",
                  "properties": [{"name": "class", "type": "str"}]}]}
                """);

        assertThat(messages(errors)).containsExactly("The property class would shadow getClass of java.lang.Object");
    }

    @Test
    void testRejectsDuplicateEnumerationValues() {
        List<GenerationError> errors = verify("""
                {"types": [{"kind": "enumeration", "name": "Size",
                  "literals": [{"name": "small", "value": "S"}, {"name": "smaller", "value": "S"}]}]}
                """);

        assertThat(messages(errors)).containsExactly("The value S is used by more than one literal");
    }
}
