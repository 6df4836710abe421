package com.metamodel.generator.model;

/**
 * Type of a property or constructor argument.
 */
public abstract class TypeAnnotation {

    TypeAnnotation() {
        // closed hierarchy
    }

    public abstract <R> R accept(TypeAnnotationVisitor<R> visitor);

    /**
     * Strips one level of {@link OptionalTypeAnnotation}, if present.
     */
    public TypeAnnotation beneathOptional() {
        return this;
    }

    public boolean isOptional() {
        return false;
    }

    /**
     * Renders the annotation in the schema dump syntax, e.g. {@code Optional[List[str]]}.
     */
    public abstract String toSchemaString();

    @Override
    public String toString() {
        return toSchemaString();
    }
}
