package com.metamodel.generator.model;

/**
 * Visitor over the closed family of type annotations.
 * Adding a new annotation kind breaks every implementation at compile time.
 */
public interface TypeAnnotationVisitor<R> {
    R visit(PrimitiveTypeAnnotation annotation);
    R visit(OurTypeAnnotation annotation);
    R visit(ListTypeAnnotation annotation);
    R visit(OptionalTypeAnnotation annotation);
}
