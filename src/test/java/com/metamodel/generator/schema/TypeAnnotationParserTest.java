package com.metamodel.generator.schema;

import org.junit.jupiter.api.Test;

import com.metamodel.generator.model.ListTypeAnnotation;
import com.metamodel.generator.model.OptionalTypeAnnotation;
import com.metamodel.generator.model.OurTypeAnnotation;
import com.metamodel.generator.model.PrimitiveType;
import com.metamodel.generator.model.PrimitiveTypeAnnotation;
import com.metamodel.generator.model.TypeAnnotation;

import static org.assertj.core.api.Assertions.*;

class TypeAnnotationParserTest {

    private final TypeAnnotationParser parser = new TypeAnnotationParser();

    @Test
    void testParsePrimitive() {
        TypeAnnotation annotation = parser.parse("bytearray");

        assertThat(annotation).isInstanceOf(PrimitiveTypeAnnotation.class);
        assertThat(((PrimitiveTypeAnnotation) annotation).getType()).isEqualTo(PrimitiveType.BYTEARRAY);
    }

    @Test
    void testParseReferenceIsUnbound() {
        TypeAnnotation annotation = parser.parse("Shape");

        assertThat(annotation).isInstanceOf(OurTypeAnnotation.class);
        assertThat(((OurTypeAnnotation) annotation).getName()).isEqualTo("Shape");
        assertThat(((OurTypeAnnotation) annotation).isResolved()).isFalse();
    }

    @Test
    void testParseNested() {
        TypeAnnotation annotation = parser.parse(" Optional[ List[Point] ] ");

        assertThat(annotation).isInstanceOf(OptionalTypeAnnotation.class);
        assertThat(annotation.isOptional()).isTrue();
        TypeAnnotation beneath = annotation.beneathOptional();
        assertThat(beneath).isInstanceOf(ListTypeAnnotation.class);
        assertThat(((ListTypeAnnotation) beneath).getItems()).isInstanceOf(OurTypeAnnotation.class);
        assertThat(annotation.toSchemaString()).isEqualTo("Optional[List[Point]]");
    }

    @Test
    void testRejectsMalformed() {
        assertThatThrownBy(() -> parser.parse("List[int"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unbalanced");
        assertThatThrownBy(() -> parser.parse("Optional[]"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Empty");
        assertThatThrownBy(() -> parser.parse("not a type"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parser.parse(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
