package com.metamodel.generator.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

@Getter
@EqualsAndHashCode(callSuper = false)
public final class PrimitiveTypeAnnotation extends AtomicTypeAnnotation {

    private final PrimitiveType type;

    public PrimitiveTypeAnnotation(@NonNull PrimitiveType type) {
        this.type = type;
    }

    @Override
    public <R> R accept(TypeAnnotationVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toSchemaString() {
        return type.getSchemaName();
    }
}
