package com.metamodel.generator.codegen.types;

import org.junit.jupiter.api.Test;

import com.metamodel.generator.TestSchemas;
import com.metamodel.generator.codegen.model.output.GeneratedFile;
import com.metamodel.generator.codegen.model.output.GeneratedFileType;

import static org.assertj.core.api.Assertions.*;

class StringificationGeneratorTest {

    private final StringificationGenerator generator = new StringificationGenerator();

    @Test
    void testGeneratesTablePerEnumeration() {
        GeneratedFile file = generator.generate(TestSchemas.drawing(), "com.example.drawing");

        assertThat(file.getType()).isEqualTo(GeneratedFileType.JAVA);
        assertThat(file.getRelativePath()).isEqualTo("src/main/java/com/example/drawing/Stringification.java");
        assertThat(file.getContents())
                .contains("import java.util.Map;")
                .contains("private static final Map<String, Color> COLOR_FROM_STRING = Map.ofEntries(")
                .contains("Map.entry(\"Light blue\", Color.LIGHT_BLUE)")
                .contains("public static Color colorFromString(String text) {")
                .contains("public static String colorToString(Color that) {");
    }

    @Test
    void testEmptyEnumerationGetsEmptyTable() {
        String table = generator.tableFor(TestSchemas.load("""
                {"types": [{"kind": "enumeration", "name": "Nothing", "literals": []}]}
                """).getEnumerations().get(0));

        assertThat(table).contains("private static final Map<String, Nothing> NOTHING_FROM_STRING = Map.ofEntries();");
    }
}
