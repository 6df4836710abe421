package com.metamodel.generator.codegen.types;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.metamodel.generator.TestSchemas;
import com.metamodel.generator.codegen.model.output.GeneratedFile;
import com.metamodel.generator.common.GenerationError;
import com.metamodel.generator.common.GenerationOutcome;
import com.metamodel.generator.model.ClassDefinition;
import com.metamodel.generator.model.ConcreteClass;
import com.metamodel.generator.model.DefaultValue;
import com.metamodel.generator.model.SymbolTable;
import com.metamodel.generator.schema.TypeAnnotationParser;
import com.metamodel.generator.specific.ImplementationKey;
import com.metamodel.generator.specific.SpecificImplementations;

import static org.assertj.core.api.Assertions.*;

class TypesGeneratorTest {

    private static final String PACKAGE = "com.example.drawing";

    private final TypesGenerator generator = new TypesGenerator();
    private SymbolTable drawing;

    @BeforeEach
    void setUp() {
        drawing = TestSchemas.drawing();
    }

    private ClassDefinition findClass(String name) {
        return (ClassDefinition) drawing.find(name).orElseThrow();
    }

    @Test
    void testGeneratesOneFilePerType() throws Exception {
        GenerationOutcome<List<GeneratedFile>> outcome =
                generator.generate(drawing, TestSchemas.drawingSnippets(), PACKAGE);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getValue()).extracting(GeneratedFile::getRelativePath)
                .map(path -> path.substring(path.lastIndexOf('/') + 1))
                .containsExactly(
                        "IClass.java", "AbstractTransformer.java", "Color.java",
                        "IShape.java", "ICircle.java", "Circle.java", "LabeledCircle.java",
                        "Polygon.java", "Point.java", "Opaque.java", "Drawing.java");
    }

    @Test
    void testReportsMissingTypeSnippet() {
        GenerationOutcome<List<GeneratedFile>> outcome =
                generator.generate(drawing, SpecificImplementations.empty(), PACKAGE);

        assertThat(outcome.getErrors()).extracting(GenerationError::getMessage).containsExactly(
                "The implementation snippet is missing for the class declaration: Types/Class/Opaque.java");
    }

    @Test
    void testImplementationSpecificClassGetsHeader() {
        SpecificImplementations specifics = SpecificImplementations.of(Map.of(
                ImplementationKey.typeDeclaration("Opaque"), "public final class Opaque implements IClass {}\n"));

        GeneratedFile opaque = generator.generate(drawing, specifics, PACKAGE).getValue().stream()
                .filter(file -> file.getRelativePath().endsWith("/Opaque.java"))
                .findFirst()
                .orElseThrow();

        assertThat(opaque.getContents())
                .startsWith("/*\n * This code has been automatically generated")
                .contains("package com.example.drawing;")
                .contains("import java.util.Objects;")
                .endsWith("public final class Opaque implements IClass {}\n");
    }

    @Test
    void testInterfacesDeclareOnlyOwnGetters() {
        String shape = generator.generateInterface(findClass("Shape"), PACKAGE);
        String circle = generator.generateInterface(findClass("Circle"), PACKAGE);

        assertThat(shape)
                .contains("public interface IShape extends IClass {")
                .contains("String getId();")
                .contains("Color getColor();")
                .contains("Identifier of the shape.");
        assertThat(circle)
                .contains("public interface ICircle extends IShape {")
                .contains("double getRadius();")
                .doesNotContain("getId()");
    }

    @Test
    void testClassImplementsItsOwnOrParentInterfaces() {
        assertThat(generator.generateClass((ConcreteClass) findClass("Circle"), PACKAGE))
                .contains("public final class Circle implements ICircle {");
        assertThat(generator.generateClass((ConcreteClass) findClass("Labeled_circle"), PACKAGE))
                .contains("public final class LabeledCircle implements ICircle {")
                .contains("return transformer.transformLabeledCircle(this);");
        assertThat(generator.generateClass((ConcreteClass) findClass("Point"), PACKAGE))
                .contains("public final class Point implements IClass {");
    }

    @Test
    void testConstructorFollowsDeclaredArguments() {
        String polygon = generator.generateClass((ConcreteClass) findClass("Polygon"), PACKAGE);

        assertThat(polygon)
                .contains("this.id = Objects.requireNonNull(id, \"id\");")
                .contains("this.vertices = List.copyOf(Objects.requireNonNull(vertices, \"vertices\"));")
                .contains("this.tags = tags == null ? null : List.copyOf(tags);")
                .contains("this.closed = closed != null ? closed : true;")
                .contains("this.color = color;");
        assertThat(polygon.indexOf("List<Point> vertices,")).isLessThan(polygon.indexOf("Color color,"));
    }

    @Test
    void testEqualityComparesBytesByContent() {
        String drawingClass = generator.generateClass((ConcreteClass) findClass("Drawing"), PACKAGE);

        assertThat(drawingClass)
                .contains("Arrays.equals(this.thumbnail, casted.thumbnail)")
                .contains("Objects.equals(this.shapes, casted.shapes)")
                .contains("return Objects.hash(shapes, Arrays.hashCode(thumbnail), visible, mainShape, opaque);");
    }

    @Test
    void testEnumerationCarriesJsonValue() {
        String color = generator.generateEnumeration(drawing.getEnumerations().get(0), PACKAGE);

        assertThat(color)
                .contains("public enum Color {")
                .contains("LIGHT_BLUE(\"Light blue\");")
                .contains("public String getValue() {");
    }

    @Test
    void testAbstractTransformerHasMethodPerConcreteClass() {
        String transformer = generator.generateAbstractTransformer(drawing, PACKAGE);

        assertThat(transformer)
                .contains("public abstract T transformCircle(Circle that);")
                .contains("public abstract T transformOpaque(Opaque that);")
                .doesNotContain("transformShape");
    }

    @Test
    void testDefaultLiterals() {
        TypeAnnotationParser parser = new TypeAnnotationParser();

        assertThat(generator.defaultLiteral(parser.parse("Optional[int]"), DefaultValue.of(3L))).isEqualTo("3L");
        assertThat(generator.defaultLiteral(parser.parse("Optional[float]"), DefaultValue.of(2L))).isEqualTo("2.0");
        assertThat(generator.defaultLiteral(parser.parse("Optional[str]"), DefaultValue.of("a\"b")))
                .isEqualTo("\"a\\\"b\"");
        assertThatThrownBy(() -> generator.defaultLiteral(parser.parse("Optional[bytearray]"), DefaultValue.of("x")))
                .isInstanceOf(IllegalStateException.class);
    }
}
