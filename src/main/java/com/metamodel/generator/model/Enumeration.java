package com.metamodel.generator.model;

import java.util.List;
import java.util.Optional;

import lombok.Getter;
import lombok.NonNull;

@Getter
public final class Enumeration extends OurType {

    private final List<EnumerationLiteral> literals;

    public Enumeration(String name, String description, @NonNull List<EnumerationLiteral> literals) {
        super(name, description);
        this.literals = List.copyOf(literals);
    }

    public Optional<EnumerationLiteral> findLiteral(String literalName) {
        return literals.stream()
                .filter(literal -> literal.getName().equals(literalName))
                .findFirst();
    }

    @Override
    public <R> R accept(OurTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
