package com.metamodel.generator.codegen.util;

import java.util.Arrays;
import java.util.stream.Collectors;

import lombok.experimental.UtilityClass;

/**
 * Casing conversions for meta-model identifiers written in snake case.
 *
 * Parts which already start with a capital letter are taken as abbreviations
 * and left as they are ({@code URL_to_something} becomes {@code URLToSomething}).
 */
@UtilityClass
public class NamingUtil {

    /**
     * Converts {@code snake_name} to {@code SnakeName}.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(name.split("_"))
                .filter(part -> !part.isEmpty())
                .map(NamingUtil::capitalizeOrLeaveAbbreviation)
                .collect(Collectors.joining(""));
    }

    /**
     * Converts {@code snake_name} to {@code snakeName}; a leading abbreviation
     * is lowered as a whole ({@code URL_to_something} becomes {@code urlToSomething}).
     */
    public static String toCamelCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        String[] parts = Arrays.stream(name.split("_"))
                .filter(part -> !part.isEmpty())
                .toArray(String[]::new);
        if (parts.length == 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder(parts[0].toLowerCase());
        for (int i = 1; i < parts.length; i++) {
            sb.append(capitalizeOrLeaveAbbreviation(parts[i]));
        }
        return sb.toString();
    }

    /**
     * Converts name to SCREAMING_SNAKE_CASE for enum constants.
     */
    public static String toScreamingSnakeCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        // Handle camelCase or PascalCase
        String result = name.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        result = result.replaceAll("[-\\s]+", "_").replaceAll("_+", "_");
        return result.toUpperCase();
    }

    /**
     * Lowers the first character only ({@code IShape} becomes {@code iShape}).
     */
    public static String lowerFirst(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    private static String capitalizeOrLeaveAbbreviation(String part) {
        if (Character.isUpperCase(part.charAt(0))) {
            return part;
        }
        return Character.toUpperCase(part.charAt(0)) + part.substring(1).toLowerCase();
    }
}
