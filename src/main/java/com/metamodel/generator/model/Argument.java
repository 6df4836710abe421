package com.metamodel.generator.model;

import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Constructor argument of a class.
 */
@Value
@Builder(toBuilder = true)
public class Argument {

    @NonNull
    String name;

    @NonNull
    TypeAnnotation typeAnnotation;

    DefaultValue defaultValue;

    public Optional<DefaultValue> getDefault() {
        return Optional.ofNullable(defaultValue);
    }

    public boolean isRequired() {
        return !typeAnnotation.isOptional();
    }
}
