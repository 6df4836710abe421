package com.metamodel.generator.schema;

import java.util.regex.Pattern;

import com.metamodel.generator.model.ListTypeAnnotation;
import com.metamodel.generator.model.OptionalTypeAnnotation;
import com.metamodel.generator.model.OurTypeAnnotation;
import com.metamodel.generator.model.PrimitiveType;
import com.metamodel.generator.model.PrimitiveTypeAnnotation;
import com.metamodel.generator.model.TypeAnnotation;

/**
 * Parses type annotations written as {@code str}, {@code Shape},
 * {@code List[Point]} or {@code Optional[List[str]]}.
 *
 * References to named types are left unbound.
 */
public class TypeAnnotationParser {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final String LIST_PREFIX = "List[";
    private static final String OPTIONAL_PREFIX = "Optional[";

    /**
     * @throws IllegalArgumentException if the text is not a valid type annotation
     */
    public TypeAnnotation parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Type annotation is missing");
        }
        return parseTrimmed(text.trim(), text);
    }

    private TypeAnnotation parseTrimmed(String text, String original) {
        if (text.startsWith(LIST_PREFIX)) {
            return new ListTypeAnnotation(parseTrimmed(inner(text, LIST_PREFIX, original), original));
        }
        if (text.startsWith(OPTIONAL_PREFIX)) {
            return new OptionalTypeAnnotation(parseTrimmed(inner(text, OPTIONAL_PREFIX, original), original));
        }
        if (!IDENTIFIER.matcher(text).matches()) {
            throw new IllegalArgumentException("Invalid type annotation: " + original);
        }
        return PrimitiveType.fromSchemaName(text)
                .<TypeAnnotation>map(PrimitiveTypeAnnotation::new)
                .orElseGet(() -> new OurTypeAnnotation(text));
    }

    private static String inner(String text, String prefix, String original) {
        if (!text.endsWith("]")) {
            throw new IllegalArgumentException("Unbalanced brackets in type annotation: " + original);
        }
        String inner = text.substring(prefix.length(), text.length() - 1).trim();
        if (inner.isEmpty()) {
            throw new IllegalArgumentException("Empty brackets in type annotation: " + original);
        }
        return inner;
    }
}
