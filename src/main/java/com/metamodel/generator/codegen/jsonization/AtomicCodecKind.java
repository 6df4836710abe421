package com.metamodel.generator.codegen.jsonization;

/**
 * How an atomic value is converted from and to JSON.
 */
public enum AtomicCodecKind {
    /**
     * Primitive coercion, also used for constrained primitives.
     */
    PRIMITIVE,
    /**
     * String looked up in the literal table.
     */
    ENUMERATION,
    /**
     * Dispatch on the discriminator over the implementers.
     */
    INTERFACE,
    /**
     * Parse routine of a concrete class without descendants.
     */
    CLASS
}
