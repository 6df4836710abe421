package com.metamodel.generator.model;

import lombok.Getter;
import lombok.NonNull;

@Getter
public final class ListTypeAnnotation extends TypeAnnotation {

    private final TypeAnnotation items;

    public ListTypeAnnotation(@NonNull TypeAnnotation items) {
        this.items = items;
    }

    @Override
    public <R> R accept(TypeAnnotationVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toSchemaString() {
        return "List[" + items.toSchemaString() + "]";
    }
}
