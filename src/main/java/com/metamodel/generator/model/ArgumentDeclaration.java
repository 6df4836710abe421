package com.metamodel.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Constructor argument as declared in the schema dump. The type may be left
 * out, in which case it is taken over from the property of the same name.
 */
@Value
@Builder
public class ArgumentDeclaration {

    @NonNull
    String name;

    TypeAnnotation typeAnnotation;

    DefaultValue defaultValue;
}
