package com.metamodel.generator.common;

import lombok.NonNull;
import lombok.Value;

/**
 * Problem discovered while loading the meta-model or generating code from it.
 *
 * Errors are reported to the operator of the tool, never to the users of the
 * generated code.
 */
@Value
public class GenerationError {

    /**
     * What the error is about, usually the name of a named type.
     */
    @NonNull
    String subject;

    @NonNull
    String message;

    public static GenerationError of(String subject, String message) {
        return new GenerationError(subject, message);
    }

    @Override
    public String toString() {
        return subject + ": " + message;
    }
}
