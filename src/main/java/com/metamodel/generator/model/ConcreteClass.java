package com.metamodel.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

public final class ConcreteClass extends ClassDefinition {

    /**
     * Whether the code for the class is written by hand instead of generated.
     */
    @Getter
    private final boolean implementationSpecific;

    @Builder
    public ConcreteClass(String name, String description,
                         @Singular List<String> inheritanceNames,
                         @Singular List<Property> ownProperties,
                         List<ArgumentDeclaration> argumentDeclarations,
                         boolean modelTypeDeclared,
                         boolean implementationSpecific) {
        super(name, description, inheritanceNames, ownProperties, argumentDeclarations, modelTypeDeclared);
        this.implementationSpecific = implementationSpecific;
    }

    @Override
    public boolean isAbstract() {
        return false;
    }

    @Override
    public <R> R accept(OurTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
