package com.metamodel.generator.model;

import java.util.List;

import lombok.Getter;
import lombok.NonNull;

/**
 * Polymorphic view of a class with descendants.
 *
 * The implementers are the concrete classes that can stand in for the base,
 * i.e. the base itself, if concrete, and all its concrete descendants.
 */
@Getter
public final class Interface {

    private final ClassDefinition base;
    private final List<ConcreteClass> implementers;

    Interface(@NonNull ClassDefinition base, @NonNull List<ConcreteClass> implementers) {
        this.base = base;
        this.implementers = List.copyOf(implementers);
    }

    public String getName() {
        return base.getName();
    }

    @Override
    public String toString() {
        return "Interface(" + getName() + ")";
    }
}
