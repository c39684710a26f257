package com.flagship.audit_trail.validation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a {@code fromSource} factory: either a valid record or the
 * violations that prevented its construction.
 *
 * Construction failures are returned, not thrown; the caller decides whether
 * to give up or retry with corrected input.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CreationResult<T> {
    T value;
    List<ValidationViolation> violations;

    public static <T> CreationResult<T> success(T value) {
        if (value == null) {
            throw new IllegalArgumentException("Successful result requires a value");
        }
        return new CreationResult<>(value, List.of());
    }

    public static <T> CreationResult<T> failure(List<ValidationViolation> violations) {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("Failed result requires at least one violation");
        }
        return new CreationResult<>(null, List.copyOf(violations));
    }

    public boolean isSuccess() {
        return value != null;
    }

    public boolean isFailure() {
        return value == null;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    /**
     * Returns the value or throws when this is a failure.
     *
     * @throws IllegalStateException if construction failed
     */
    public T orElseThrow() {
        if (value == null) {
            throw new IllegalStateException("No value present: " + violations.get(0).getMessage());
        }
        return value;
    }

    public <R> CreationResult<R> map(Function<T, R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(violations);
    }
}
