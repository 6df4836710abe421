package com.metamodel.generator.specific;

import lombok.NonNull;
import lombok.Value;

/**
 * Key of a hand-written fragment, following {@code <area>/<direction>/<TypeName>.<ext>}.
 */
@Value
public class ImplementationKey {

    static final String EXTENSION = ".java";

    @NonNull
    String path;

    public static ImplementationKey of(String area, String direction, String typeName) {
        return new ImplementationKey(area + "/" + direction + "/" + typeName + EXTENSION);
    }

    /**
     * Declaration of an implementation-specific class.
     */
    public static ImplementationKey typeDeclaration(String className) {
        return of("Types", "Class", className);
    }

    /**
     * Parse routine of an implementation-specific class.
     */
    public static ImplementationKey deserialization(String className) {
        return of("Jsonization", "DeserializeImplementation", className);
    }

    /**
     * Transformation of an implementation-specific class into JSON.
     */
    public static ImplementationKey transformation(String className) {
        return of("Jsonization", "Transformer", className);
    }

    @Override
    public String toString() {
        return path;
    }
}
