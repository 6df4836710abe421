package com.metamodel.generator.codegen.types;

import java.util.ArrayList;
import java.util.List;

import com.metamodel.generator.codegen.model.output.GeneratedFile;
import com.metamodel.generator.codegen.naming.JavaNaming;
import com.metamodel.generator.codegen.util.JavaSourceUtil;
import com.metamodel.generator.codegen.util.NamingUtil;
import com.metamodel.generator.model.Enumeration;
import com.metamodel.generator.model.EnumerationLiteral;
import com.metamodel.generator.model.SymbolTable;

/**
 * Generates {@code Stringification.java}: the static tables between the
 * enumeration literals and their JSON text.
 */
public class StringificationGenerator {

    public GeneratedFile generate(SymbolTable symbolTable, String packageName) {
        List<String> blocks = new ArrayList<>();
        blocks.add("""
                private Stringification() {
                    // Prevent instantiation
                }""");

        for (Enumeration enumeration : symbolTable.getEnumerations()) {
            blocks.add(tableFor(enumeration));
        }

        String contents = JavaSourceUtil.fileHeader(packageName, List.of(List.of("java.util.Map")))
                + """
                /**
                 * Convert enumeration literals from and to their JSON text.
                 */
                public final class Stringification {
                %s
                }
                """.formatted(JavaSourceUtil.indent(JavaSourceUtil.joinBlocks(blocks), 1));
        return GeneratedFile.java(packageName, "Stringification", contents);
    }

    String tableFor(Enumeration enumeration) {
        String enumName = JavaNaming.enumName(enumeration.getName());
        String table = NamingUtil.toScreamingSnakeCase(enumeration.getName()) + "_FROM_STRING";

        List<String> entries = new ArrayList<>();
        for (EnumerationLiteral literal : enumeration.getLiterals()) {
            entries.add("Map.entry(%s, %s.%s)".formatted(
                    JavaSourceUtil.stringLiteral(literal.getValue()),
                    enumName,
                    JavaNaming.enumLiteralName(literal.getName())));
        }
        String initializer = entries.isEmpty()
                ? "Map.ofEntries()"
                : "Map.ofEntries(\n" + JavaSourceUtil.indent(String.join(",\n", entries), 2) + ")";

        return """
                private static final Map<String, %1$s> %2$s = %3$s;

                /**
                 * Parse the JSON text of a {@link %1$s} literal.
                 *
                 * @return the literal, or null if the text matches none
                 */
                public static %1$s %4$s(String text) {
                    return %2$s.get(text);
                }

                public static String %5$s(%1$s that) {
                    return that.getValue();
                }""".formatted(
                enumName,
                table,
                initializer,
                JavaNaming.fromStringMethodName(enumeration.getName()),
                JavaNaming.toStringMethodName(enumeration.getName()));
    }
}
