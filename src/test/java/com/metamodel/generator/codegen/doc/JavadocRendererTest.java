package com.metamodel.generator.codegen.doc;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class JavadocRendererTest {

    @Test
    void testRendersNothingForBlankDescription() {
        assertThat(JavadocRenderer.render(null)).isEmpty();
        assertThat(JavadocRenderer.render("  ")).isEmpty();
        assertThat(JavadocRenderer.renderLine(null)).isEmpty();
    }

    @Test
    void testRendersMultipleLines() {
        assertThat(JavadocRenderer.render("First line.\n\nSecond line.  "))
                .hasValue("/**\n * First line.\n *\n * Second line.\n */");
    }

    @Test
    void testEscapesMarkupAndCommentEnd() {
        assertThat(JavadocRenderer.renderLine("a < b && c */ @see"))
                .isEqualTo("/**\n * a &lt; b &amp;&amp; c *&#47; &#64;see\n */\n");
    }

    @Test
    void testEscapesBackslashesSoNoUnicodeEscapeSurvives() {
        String rendered = JavadocRenderer.renderLine("Stored under C:\\users\\points, see \\u000a");

        assertThat(rendered).isEqualTo("/**\n * Stored under C:&#92;users&#92;points, see &#92;u000a\n */\n");
        assertThat(rendered).doesNotContain("\\");
    }
}
