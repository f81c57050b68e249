package com.baz.contactsapi.validation;

import java.util.function.Function;

/**
 * Outcome of validating or converting a contact: either a value or the first error found.
 */
public sealed interface ValidationResult<T> permits ValidationResult.Valid, ValidationResult.Invalid {

    static <T> ValidationResult<T> valid(T value) {
        return new Valid<>(value);
    }

    static <T> ValidationResult<T> invalid(ValidationError error) {
        return new Invalid<>(error);
    }

    default boolean isValid() {
        return this instanceof Valid;
    }

    default <R> ValidationResult<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Valid<T> valid) {
            return new Valid<>(mapper.apply(valid.value()));
        }
        return new Invalid<>(((Invalid<T>) this).error());
    }

    default <R> ValidationResult<R> flatMap(Function<? super T, ValidationResult<R>> mapper) {
        if (this instanceof Valid<T> valid) {
            return mapper.apply(valid.value());
        }
        return new Invalid<>(((Invalid<T>) this).error());
    }

    default T orElseThrow(Function<ValidationError, ? extends RuntimeException> exceptionFactory) {
        if (this instanceof Valid<T> valid) {
            return valid.value();
        }
        throw exceptionFactory.apply(((Invalid<T>) this).error());
    }

    record Valid<T>(T value) implements ValidationResult<T> {
    }

    record Invalid<T>(ValidationError error) implements ValidationResult<T> {
    }
}
