package com.metamodel.generator.codegen.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class NamingUtilTest {

    @Test
    void testPascalCase() {
        assertThat(NamingUtil.toPascalCase("something")).isEqualTo("Something");
        assertThat(NamingUtil.toPascalCase("labeled_circle")).isEqualTo("LabeledCircle");
        assertThat(NamingUtil.toPascalCase("Labeled_circle")).isEqualTo("LabeledCircle");
    }

    @Test
    void testPascalCaseLeavesAbbreviations() {
        assertThat(NamingUtil.toPascalCase("URL_to_something")).isEqualTo("URLToSomething");
        assertThat(NamingUtil.toPascalCase("something_to_URL")).isEqualTo("SomethingToURL");
    }

    @Test
    void testCamelCase() {
        assertThat(NamingUtil.toCamelCase("main_shape")).isEqualTo("mainShape");
        assertThat(NamingUtil.toCamelCase("Something")).isEqualTo("something");
        assertThat(NamingUtil.toCamelCase("URL_to_something")).isEqualTo("urlToSomething");
        assertThat(NamingUtil.toCamelCase("something_to_URL")).isEqualTo("somethingToURL");
    }

    @Test
    void testScreamingSnakeCase() {
        assertThat(NamingUtil.toScreamingSnakeCase("light_blue")).isEqualTo("LIGHT_BLUE");
        assertThat(NamingUtil.toScreamingSnakeCase("Color")).isEqualTo("COLOR");
        assertThat(NamingUtil.toScreamingSnakeCase("Non_empty_string")).isEqualTo("NON_EMPTY_STRING");
    }

    @Test
    void testLowerFirst() {
        assertThat(NamingUtil.lowerFirst("IShape")).isEqualTo("iShape");
        assertThat(NamingUtil.lowerFirst("")).isEmpty();
    }
}
