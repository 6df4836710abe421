package com.metamodel.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A literal of an enumeration.
 */
@Value
@Builder
public class EnumerationLiteral {

    /**
     * Identifier of the literal in the meta-model.
     */
    @NonNull
    String name;

    /**
     * Text used to represent the literal on the wire.
     */
    @NonNull
    String value;

    String description;
}
