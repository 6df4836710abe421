package com.metamodel.generator.common;

import java.util.List;
import java.util.function.Function;

/**
 * Either a generated value or the non-empty list of errors which prevented it.
 */
public final class GenerationOutcome<T> {

    private final T value;
    private final List<GenerationError> errors;

    private GenerationOutcome(T value, List<GenerationError> errors) {
        this.value = value;
        this.errors = errors;
    }

    public static <T> GenerationOutcome<T> success(T value) {
        if (value == null) {
            throw new IllegalArgumentException("Successful outcome requires a value");
        }
        return new GenerationOutcome<>(value, List.of());
    }

    public static <T> GenerationOutcome<T> failure(List<GenerationError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("Failed outcome requires at least one error");
        }
        return new GenerationOutcome<>(null, List.copyOf(errors));
    }

    public boolean isSuccess() {
        return value != null;
    }

    public T getValue() {
        if (value == null) {
            throw new IllegalStateException("Outcome failed: " + errors);
        }
        return value;
    }

    public List<GenerationError> getErrors() {
        return errors;
    }

    public <U> GenerationOutcome<U> map(Function<? super T, ? extends U> mapper) {
        if (value == null) {
            return new GenerationOutcome<>(null, errors);
        }
        return success(mapper.apply(value));
    }
}
