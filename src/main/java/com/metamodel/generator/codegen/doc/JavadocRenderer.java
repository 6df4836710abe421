package com.metamodel.generator.codegen.doc;

import java.util.Optional;

/**
 * Renders meta-model descriptions as Javadoc comments.
 */
public class JavadocRenderer {

    private JavadocRenderer() {
        // Utility class
    }

    /**
     * Javadoc block for the description, or empty if there is nothing to document.
     */
    public static Optional<String> render(String description) {
        if (description == null || description.isBlank()) {
            return Optional.empty();
        }
        StringBuilder sb = new StringBuilder("/**\n");
        for (String line : description.strip().split("\\R", -1)) {
            String escaped = escape(line.stripTrailing());
            sb.append(escaped.isEmpty() ? " *" : " * " + escaped).append('\n');
        }
        sb.append(" */");
        return Optional.of(sb.toString());
    }

    /**
     * Rendered block followed by a line break, or nothing.
     */
    public static String renderLine(String description) {
        return render(description).map(block -> block + "\n").orElse("");
    }

    static String escape(String text) {
        return text.replace("&", "&amp;")
                .replace("\\", "&#92;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("*/", "*&#47;")
                .replace("@", "&#64;");
    }
}
