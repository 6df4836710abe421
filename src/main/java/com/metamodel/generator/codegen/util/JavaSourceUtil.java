package com.metamodel.generator.codegen.util;

import java.util.List;

/**
 * Helpers for emitting Java source text.
 */
public class JavaSourceUtil {

    public static final String INDENT = "    ";

    public static final String WARNING = """
            /*
             * This code has been automatically generated by metamodel-codegen.
             * Do NOT edit or append.
             */""";

    private JavaSourceUtil() {
        // Utility class
    }

    /**
     * Quotes and escapes the text as a Java string literal.
     */
    public static String stringLiteral(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2);
        sb.append('"');
        for (char c : text.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20 || c > 0x7e) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
        return sb.toString();
    }

    /**
     * Warning, package declaration and imports; import groups are separated by a blank line.
     */
    public static String fileHeader(String packageName, List<List<String>> importGroups) {
        StringBuilder sb = new StringBuilder();
        sb.append(WARNING).append("\n\n");
        sb.append("package ").append(packageName).append(";\n");
        for (List<String> group : importGroups) {
            if (group.isEmpty()) {
                continue;
            }
            sb.append('\n');
            for (String imported : group) {
                sb.append("import ").append(imported).append(";\n");
            }
        }
        sb.append('\n');
        return sb.toString();
    }

    /**
     * Indents every non-blank line of the block by the given number of levels.
     */
    public static String indent(String block, int levels) {
        String prefix = INDENT.repeat(levels);
        StringBuilder sb = new StringBuilder();
        String[] lines = block.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            if (!lines[i].isBlank()) {
                sb.append(prefix).append(lines[i]);
            }
        }
        return sb.toString();
    }

    /**
     * Joins blocks with a blank line in between.
     */
    public static String joinBlocks(Iterable<String> blocks) {
        StringBuilder sb = new StringBuilder();
        for (String block : blocks) {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(stripTrailing(block));
        }
        return sb.toString();
    }

    private static String stripTrailing(String block) {
        int end = block.length();
        while (end > 0 && Character.isWhitespace(block.charAt(end - 1))) {
            end--;
        }
        return block.substring(0, end);
    }
}
