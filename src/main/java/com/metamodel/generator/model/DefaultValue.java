package com.metamodel.generator.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Default of an optional constructor argument.
 *
 * The value is a {@link Boolean}, {@link Long}, {@link Double} or {@link String};
 * for enumeration-typed arguments it is the name of the literal.
 */
@Value
public class DefaultValue {

    @NonNull
    Object value;

    public static DefaultValue of(Object value) {
        return new DefaultValue(value);
    }
}
