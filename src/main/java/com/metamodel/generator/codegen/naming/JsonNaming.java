package com.metamodel.generator.codegen.naming;

import com.metamodel.generator.codegen.util.NamingUtil;

/**
 * Naming convention of the JSON wire format, independent of the target language.
 */
public final class JsonNaming {

    /**
     * Reserved key carrying the concrete class of a polymorphic object.
     */
    public static final String MODEL_TYPE_KEY = "modelType";

    private JsonNaming() {
        // Utility class
    }

    /**
     * External name of a property, e.g. {@code main_shape} becomes {@code mainShape}.
     */
    public static String propertyName(String identifier) {
        return NamingUtil.toCamelCase(identifier);
    }

    /**
     * Discriminator value of a concrete class, e.g. {@code Labeled_circle} becomes {@code LabeledCircle}.
     */
    public static String modelType(String classIdentifier) {
        return NamingUtil.toPascalCase(classIdentifier);
    }
}
