package com.hooky.domain.model;

import java.util.function.Function;

/**
 * Outcome of an operation whose expected failures (unknown receiver, expired receiver,
 * malformed id) are part of its contract. Unexpected failures are thrown instead.
 *
 * @param <T> the type of the success value
 * @param <E> the type of the error
 */
public sealed interface Result<T, E> permits Result.Success, Result.Failure {

    record Success<T, E>(T value) implements Result<T, E> {
    }

    record Failure<T, E>(E error) implements Result<T, E> {
    }

    static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }

    default boolean isSuccess() {
        return this instanceof Success<T, E>;
    }

    default boolean isFailure() {
        return this instanceof Failure<T, E>;
    }

    default T getOrThrow() {
        if (this instanceof Success<T, E> success) {
            return success.value();
        }
        throw new IllegalStateException("Cannot get value from Failure: " + errorOrNull());
    }

    default E errorOrNull() {
        return this instanceof Failure<T, E> failure ? failure.error() : null;
    }

    @SuppressWarnings("unchecked")
    default <U> Result<U, E> map(Function<T, U> mapper) {
        if (this instanceof Success<T, E> success) {
            return new Success<>(mapper.apply(success.value()));
        }
        return (Result<U, E>) this;
    }

    @SuppressWarnings("unchecked")
    default <U> Result<U, E> flatMap(Function<T, Result<U, E>> mapper) {
        if (this instanceof Success<T, E> success) {
            return mapper.apply(success.value());
        }
        return (Result<U, E>) this;
    }

    /**
     * Collapses both branches into one value, typically an HTTP response.
     */
    default <R> R fold(Function<T, R> onSuccess, Function<E, R> onFailure) {
        if (this instanceof Success<T, E> success) {
            return onSuccess.apply(success.value());
        }
        return onFailure.apply(errorOrNull());
    }
}
