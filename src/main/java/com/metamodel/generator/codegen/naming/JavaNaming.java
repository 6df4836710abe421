package com.metamodel.generator.codegen.naming;

import java.util.Set;

import com.metamodel.generator.codegen.util.NamingUtil;

/**
 * Java identifiers for the generated code.
 */
public final class JavaNaming {

    private static final Set<String> KEYWORDS = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
            "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
            "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
            "volatile", "while", "true", "false", "null", "var", "record", "yield");

    private JavaNaming() {
        // Utility class
    }

    public static String className(String identifier) {
        return NamingUtil.toPascalCase(identifier);
    }

    public static String interfaceName(String identifier) {
        return "I" + NamingUtil.toPascalCase(identifier);
    }

    public static String enumName(String identifier) {
        return NamingUtil.toPascalCase(identifier);
    }

    public static String enumLiteralName(String identifier) {
        return NamingUtil.toScreamingSnakeCase(identifier);
    }

    /**
     * Name of a field, argument or local variable.
     */
    public static String variableName(String identifier) {
        String name = NamingUtil.toCamelCase(identifier);
        return KEYWORDS.contains(name) ? name + "_" : name;
    }

    public static String getterName(String propertyIdentifier) {
        return "get" + NamingUtil.toPascalCase(propertyIdentifier);
    }

    /**
     * Name of the parse routine for the Java type, e.g. {@code IShape} gives {@code iShapeFrom}.
     */
    public static String fromMethodName(String javaTypeName) {
        return NamingUtil.lowerFirst(javaTypeName) + "From";
    }

    public static String transformMethodName(String classIdentifier) {
        return "transform" + NamingUtil.toPascalCase(classIdentifier);
    }

    public static String toJsonValueMethodName(String enumIdentifier) {
        return NamingUtil.lowerFirst(enumName(enumIdentifier)) + "ToJsonValue";
    }

    /**
     * Name of the lookup in {@code Stringification}, e.g. {@code colorFromString}.
     */
    public static String fromStringMethodName(String enumIdentifier) {
        return NamingUtil.lowerFirst(enumName(enumIdentifier)) + "FromString";
    }

    public static String toStringMethodName(String enumIdentifier) {
        return NamingUtil.lowerFirst(enumName(enumIdentifier)) + "ToString";
    }

    public static boolean isKeyword(String name) {
        return KEYWORDS.contains(name);
    }
}
