package com.metamodel.generator.model;

import java.util.List;
import java.util.Optional;

import lombok.Getter;
import lombok.NonNull;

/**
 * Common structure of abstract and concrete classes.
 *
 * Instances are created with their declarations only. Inheritance, inherited
 * properties, constructor arguments and the interface are filled in by
 * {@link SymbolTableBuilder}; afterwards the class is not modified anymore.
 */
@Getter
public abstract class ClassDefinition extends OurType {

    private final List<String> inheritanceNames;
    private final List<Property> ownProperties;

    /**
     * Declared constructor arguments, or null if the constructor takes all
     * the properties in order.
     */
    private final List<ArgumentDeclaration> argumentDeclarations;

    private final boolean modelTypeDeclared;

    private List<ClassDefinition> inheritances = List.of();
    private List<ClassDefinition> descendants = List.of();
    private List<Property> properties = List.of();
    private List<Argument> constructorArguments = List.of();
    private Interface classInterface;
    private boolean withModelType;

    ClassDefinition(String name, String description,
                    @NonNull List<String> inheritanceNames,
                    @NonNull List<Property> ownProperties,
                    List<ArgumentDeclaration> argumentDeclarations,
                    boolean modelTypeDeclared) {
        super(name, description);
        this.inheritanceNames = List.copyOf(inheritanceNames);
        this.ownProperties = List.copyOf(ownProperties);
        this.argumentDeclarations = argumentDeclarations == null ? null : List.copyOf(argumentDeclarations);
        this.modelTypeDeclared = modelTypeDeclared;
    }

    /**
     * Interface synthesized for the class, present iff the class has descendants.
     */
    public Optional<Interface> getInterface() {
        return Optional.ofNullable(classInterface);
    }

    public Optional<Property> findProperty(String propertyName) {
        return properties.stream()
                .filter(property -> property.getName().equals(propertyName))
                .findFirst();
    }

    public abstract boolean isAbstract();

    void resolveInheritance(List<ClassDefinition> inheritances, List<ClassDefinition> descendants) {
        this.inheritances = List.copyOf(inheritances);
        this.descendants = List.copyOf(descendants);
    }

    void resolveMembers(List<Property> properties, List<Argument> constructorArguments) {
        this.properties = List.copyOf(properties);
        this.constructorArguments = List.copyOf(constructorArguments);
    }

    void resolveInterface(Interface classInterface, boolean withModelType) {
        this.classInterface = classInterface;
        this.withModelType = withModelType;
    }
}
