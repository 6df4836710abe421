package com.metamodel.generator.codegen.jsonization;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.metamodel.generator.TestSchemas;
import com.metamodel.generator.model.ClassDefinition;
import com.metamodel.generator.model.PrimitiveType;
import com.metamodel.generator.model.SymbolTable;
import com.metamodel.generator.model.TypeAnnotation;
import com.metamodel.generator.schema.TypeAnnotationParser;

import static org.assertj.core.api.Assertions.*;

class TypeAnnotationResolverTest {

    private final TypeAnnotationResolver resolver = new TypeAnnotationResolver();
    private SymbolTable drawing;

    @BeforeEach
    void setUp() {
        drawing = TestSchemas.drawing();
    }

    private CodecStrategy resolveProperty(String className, String propertyName) {
        ClassDefinition cls = (ClassDefinition) drawing.find(className).orElseThrow();
        return resolver.resolve(cls.findProperty(propertyName).orElseThrow().getTypeAnnotation());
    }

    @Test
    void testConstrainedPrimitiveIsParsedAsConstrainee() {
        CodecStrategy strategy = resolveProperty("Circle", "id");

        assertThat(strategy.isOptional()).isFalse();
        assertThat(strategy.isList()).isFalse();
        assertThat(strategy.getAtomic().getKind()).isEqualTo(AtomicCodecKind.PRIMITIVE);
        assertThat(strategy.getAtomic().getPrimitiveType()).isEqualTo(PrimitiveType.STR);
        assertThat(strategy.getAtomic().getParseMethod()).isEqualTo("stringFrom");
        assertThat(strategy.getAtomic().getOurType().getName()).isEqualTo("Non_empty_string");
    }

    @Test
    void testOptionalEnumeration() {
        CodecStrategy strategy = resolveProperty("Polygon", "color");

        assertThat(strategy.isOptional()).isTrue();
        assertThat(strategy.getAtomic().getKind()).isEqualTo(AtomicCodecKind.ENUMERATION);
        assertThat(strategy.getAtomic().getParseMethod()).isEqualTo("colorFrom");
        assertThat(strategy.slotType()).isEqualTo("Color");
    }

    @Test
    void testListOfAbstractClassDispatchesThroughInterface() {
        CodecStrategy strategy = resolveProperty("Drawing", "shapes");

        assertThat(strategy.isList()).isTrue();
        assertThat(strategy.getAtomic().getKind()).isEqualTo(AtomicCodecKind.INTERFACE);
        assertThat(strategy.getAtomic().getParseMethod()).isEqualTo("iShapeFrom");
        assertThat(strategy.slotType()).isEqualTo("List<IShape>");
    }

    @Test
    void testOptionalListOfPrimitives() {
        CodecStrategy strategy = resolveProperty("Polygon", "tags");

        assertThat(strategy.isOptional()).isTrue();
        assertThat(strategy.isList()).isTrue();
        assertThat(strategy.slotType()).isEqualTo("List<String>");
    }

    @Test
    void testLeafClassIsParsedDirectly() {
        CodecStrategy strategy = resolveProperty("Polygon", "vertices");

        assertThat(strategy.getAtomic().getKind()).isEqualTo(AtomicCodecKind.CLASS);
        assertThat(strategy.getAtomic().getParseMethod()).isEqualTo("pointFrom");
    }

    @Test
    void testBoxesPrimitives() {
        assertThat(resolveProperty("Point", "x").slotType()).isEqualTo("Long");
        assertThat(resolveProperty("Drawing", "thumbnail").slotType()).isEqualTo("byte[]");
        assertThat(resolveProperty("Drawing", "visible").getAtomic().getParseMethod()).isEqualTo("boolFrom");
    }

    @Test
    void testRejectsNestedLists() {
        TypeAnnotation nested = new TypeAnnotationParser().parse("List[List[int]]");

        assertThatThrownBy(() -> resolver.resolve(nested))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Unsupported type annotation");
    }
}
