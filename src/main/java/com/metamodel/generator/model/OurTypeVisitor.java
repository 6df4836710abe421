package com.metamodel.generator.model;

/**
 * Visitor over the closed family of named types.
 */
public interface OurTypeVisitor<R> {
    R visit(Enumeration enumeration);
    R visit(ConstrainedPrimitive constrainedPrimitive);
    R visit(AbstractClass abstractClass);
    R visit(ConcreteClass concreteClass);
}
