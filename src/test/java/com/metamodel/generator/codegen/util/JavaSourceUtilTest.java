package com.metamodel.generator.codegen.util;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class JavaSourceUtilTest {

    @Test
    void testStringLiteralEscapes() {
        assertThat(JavaSourceUtil.stringLiteral("plain")).isEqualTo("\"plain\"");
        assertThat(JavaSourceUtil.stringLiteral("say \"hi\"\n")).isEqualTo("\"say \\\"hi\\\"\\n\"");
        assertThat(JavaSourceUtil.stringLiteral("back\\slash")).isEqualTo("\"back\\\\slash\"");
        assertThat(JavaSourceUtil.stringLiteral("\u00e9")).isEqualTo("\"\\u00e9\"");
    }

    @Test
    void testIndentSkipsBlankLines() {
        assertThat(JavaSourceUtil.indent("a\n\nb", 1)).isEqualTo("    a\n\n    b");
        assertThat(JavaSourceUtil.indent("a\n", 2)).isEqualTo("        a\n");
    }

    @Test
    void testJoinBlocks() {
        assertThat(JavaSourceUtil.joinBlocks(List.of("a\n", "b  ", "c"))).isEqualTo("a\n\nb\n\nc");
    }

    @Test
    void testFileHeader() {
        String header = JavaSourceUtil.fileHeader("com.example",
                List.of(List.of("java.util.List"), List.of(), List.of("com.fasterxml.jackson.databind.JsonNode")));

        assertThat(header).startsWith(JavaSourceUtil.WARNING);
        assertThat(header).contains("package com.example;\n\nimport java.util.List;\n\n"
                + "import com.fasterxml.jackson.databind.JsonNode;\n");
    }
}
