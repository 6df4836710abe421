package com.metamodel.generator.model;

import lombok.Getter;
import lombok.NonNull;

/**
 * Named type of the meta-model: an enumeration, a constrained primitive or a class.
 */
@Getter
public abstract class OurType {

    /**
     * Name as given in the meta-model, in snake case (e.g. {@code Labeled_circle}).
     */
    private final String name;

    private final String description;

    OurType(@NonNull String name, String description) {
        this.name = name;
        this.description = description;
    }

    public abstract <R> R accept(OurTypeVisitor<R> visitor);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ")";
    }
}
