package com.metamodel.generator.codegen.jsonization;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.metamodel.generator.TestSchemas;
import com.metamodel.generator.model.ClassDefinition;
import com.metamodel.generator.model.ConcreteClass;
import com.metamodel.generator.model.SymbolTable;

import static org.assertj.core.api.Assertions.*;

class DeserializationGeneratorTest {

    private final DeserializationGenerator generator = new DeserializationGenerator(new TypeAnnotationResolver());
    private SymbolTable drawing;

    @BeforeEach
    void setUp() {
        drawing = TestSchemas.drawing();
    }

    private ClassDefinition findClass(String name) {
        return (ClassDefinition) drawing.find(name).orElseThrow();
    }

    @Test
    void testEnumerationRoutineLooksUpStringification() {
        String routine = generator.enumerationFrom(drawing.getEnumerations().get(0));

        assertThat(routine)
                .contains("static Reporting.Result<Color> colorFrom(JsonNode node)")
                .contains("Stringification.colorFromString(text.getValue())")
                .contains("\"Not a valid JSON representation of Color\"");
    }

    @Test
    void testInterfaceRoutineDispatchesOnModelType() {
        String routine = generator.interfaceFrom(findClass("Shape").getInterface().orElseThrow());

        assertThat(routine)
                .contains("static Reporting.Result<IShape> iShapeFrom(JsonNode node)")
                .contains("node.get(\"modelType\")")
                .contains("case \"Circle\":")
                .contains("case \"LabeledCircle\":")
                .contains("case \"Polygon\":")
                .contains("Reporting.Result.widen(DeserializeImplementation.labeledCircleFrom(node))")
                .contains("\"Unexpected model type for IShape: \" + modelType")
                .doesNotContain("case \"Shape\":");
    }

    @Test
    void testClassRoutineFollowsConstructorOrder() {
        String routine = generator.concreteClassFrom((ConcreteClass) findClass("Polygon"));

        assertThat(routine)
                .contains("String theId = null;")
                .contains("List<Point> theVertices = null;")
                .contains("List<String> theTags = null;")
                .contains("Boolean theClosed = null;")
                .contains("case \"modelType\":")
                .contains("\"Required property \\\"vertices\\\" is missing\"")
                .doesNotContain("\"Required property \\\"closed\\\" is missing\"");
        assertThat(routine.indexOf("theVertices,")).isLessThan(routine.indexOf("theColor,"));
    }

    @Test
    void testLeafOutsideHierarchyRejectsModelType() {
        String routine = generator.concreteClassFrom((ConcreteClass) findClass("Point"));

        assertThat(routine)
                .doesNotContain("case \"modelType\":")
                .contains("\"Unexpected property: \" + keyValue.getKey()");
    }

    @Test
    void testSlotNames() {
        ConcreteClass drawingClass = (ConcreteClass) findClass("Drawing");

        assertThat(drawingClass.getConstructorArguments())
                .extracting(DeserializationGenerator::slotName)
                .containsExactly("theShapes", "theThumbnail", "theVisible", "theMainShape", "theOpaque");
    }
}
