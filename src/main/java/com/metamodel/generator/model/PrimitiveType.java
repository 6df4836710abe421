package com.metamodel.generator.model;

import java.util.Optional;

/**
 * Primitive kinds a meta-model value can be built from.
 */
public enum PrimitiveType {
    BOOL("bool"),
    INT("int"),
    FLOAT("float"),
    STR("str"),
    BYTEARRAY("bytearray");

    private final String schemaName;

    PrimitiveType(String schemaName) {
        this.schemaName = schemaName;
    }

    /**
     * Name of the primitive as written in a schema model dump.
     */
    public String getSchemaName() {
        return schemaName;
    }

    public static Optional<PrimitiveType> fromSchemaName(String name) {
        for (PrimitiveType type : values()) {
            if (type.schemaName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
