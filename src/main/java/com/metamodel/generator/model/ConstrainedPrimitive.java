package com.metamodel.generator.model;

import lombok.Getter;
import lombok.NonNull;

/**
 * Primitive value with semantic constraints. The constraints are not
 * enforced by the JSON codec, only the constrainee is.
 */
@Getter
public final class ConstrainedPrimitive extends OurType {

    private final PrimitiveType constrainee;

    public ConstrainedPrimitive(String name, String description, @NonNull PrimitiveType constrainee) {
        super(name, description);
        this.constrainee = constrainee;
    }

    @Override
    public <R> R accept(OurTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
