package com.lionreader.platform.common;

import com.lionreader.platform.common.errors.UseCaseError;

/**
 * Result type for operations that can fail validation.
 *
 * <p>This is a sealed interface with two variants:
 * <ul>
 *   <li>{@link Success} - contains the successful result value</li>
 *   <li>{@link Failure} - contains the error details</li>
 * </ul>
 *
 * <p>Usage in API layer:
 * <pre>{@code
 * if (result instanceof Result.Failure<OAuthClient> f) {
 *     return Response.status(400).entity(f.error()).build();
 * }
 * }</pre>
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    boolean isSuccess();

    /**
     * Successful result containing the value.
     */
    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * Failed result containing the error.
     */
    record Failure<T>(UseCaseError error) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(UseCaseError error) {
        return new Failure<>(error);
    }
}
