package com.metamodel.generator.model;

import lombok.Getter;
import lombok.NonNull;

/**
 * Reference to a named type of the meta-model.
 *
 * The referenced type is bound after all the named types have been created,
 * since the references may be cyclic.
 */
public final class OurTypeAnnotation extends AtomicTypeAnnotation {

    @Getter
    private final String name;

    private OurType ourType;

    public OurTypeAnnotation(@NonNull String name) {
        this.name = name;
    }

    public OurTypeAnnotation(@NonNull OurType ourType) {
        this.name = ourType.getName();
        this.ourType = ourType;
    }

    public OurType getOurType() {
        if (ourType == null) {
            throw new IllegalStateException("Reference to " + name + " has not been resolved");
        }
        return ourType;
    }

    public boolean isResolved() {
        return ourType != null;
    }

    void bind(OurType resolved) {
        if (ourType != null && ourType != resolved) {
            throw new IllegalStateException("Reference to " + name + " is already bound");
        }
        this.ourType = resolved;
    }

    @Override
    public <R> R accept(TypeAnnotationVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toSchemaString() {
        return name;
    }
}
