package com.metamodel.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;

/**
 * Class which can not be instantiated; it is only visible through its interface.
 */
public final class AbstractClass extends ClassDefinition {

    @Builder
    public AbstractClass(String name, String description,
                         @Singular List<String> inheritanceNames,
                         @Singular List<Property> ownProperties,
                         List<ArgumentDeclaration> argumentDeclarations,
                         boolean modelTypeDeclared) {
        super(name, description, inheritanceNames, ownProperties, argumentDeclarations, modelTypeDeclared);
    }

    @Override
    public boolean isAbstract() {
        return true;
    }

    @Override
    public <R> R accept(OurTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
