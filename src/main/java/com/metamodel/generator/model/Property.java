package com.metamodel.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Property of a class.
 */
@Value
@Builder(toBuilder = true)
public class Property {

    @NonNull
    String name;

    @NonNull
    TypeAnnotation typeAnnotation;

    String description;

    /**
     * Name of the class which declared the property; differs from the owner
     * for inherited properties.
     */
    @NonNull
    String declaringClass;
}
