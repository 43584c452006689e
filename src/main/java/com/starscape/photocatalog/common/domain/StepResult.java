package com.starscape.photocatalog.common.domain;

import java.util.Optional;

/**
 * Outcome of one pipeline step: either a value or a human-readable error.
 * A successful step may carry a null value (e.g. "nothing to store").
 */
public record StepResult<T>(
    T value,
    String error
) {
    
    public static <T> StepResult<T> success(T value) {
        return new StepResult<>(value, null);
    }
    
    public static <T> StepResult<T> failure(String error) {
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("Error message cannot be blank");
        }
        return new StepResult<>(null, error);
    }
    
    public boolean isSuccess() {
        return error == null;
    }
    
    public boolean isFailure() {
        return error != null;
    }
    
    public Optional<T> asOptional() {
        return Optional.ofNullable(value);
    }
}
