package com.metamodel.generator.model;

import lombok.Getter;
import lombok.NonNull;

@Getter
public final class OptionalTypeAnnotation extends TypeAnnotation {

    private final TypeAnnotation value;

    public OptionalTypeAnnotation(@NonNull TypeAnnotation value) {
        this.value = value;
    }

    @Override
    public TypeAnnotation beneathOptional() {
        return value;
    }

    @Override
    public boolean isOptional() {
        return true;
    }

    @Override
    public <R> R accept(TypeAnnotationVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toSchemaString() {
        return "Optional[" + value.toSchemaString() + "]";
    }
}
