package com.metamodel.generator.model;

/**
 * Annotation that neither wraps another annotation: a primitive or a named type.
 */
public abstract class AtomicTypeAnnotation extends TypeAnnotation {

    AtomicTypeAnnotation() {
        // closed hierarchy
    }
}
