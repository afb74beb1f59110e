package com.mts.common.status;

import java.util.Objects;

/**
 * Outcome of a registry, catalog or coordinator operation: either a value or a
 * {@link StatusCode} with a human-readable message. Components hand these back
 * instead of throwing across their boundary.
 *
 * @param <T> the type of the value on success
 */
public final class Result<T> {

    private final StatusCode code;
    private final T value;
    private final String message;

    private Result(StatusCode code, T value, String message) {
        this.code = code;
        this.value = value;
        this.message = message;
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(StatusCode.OK, value, null);
    }

    public static Result<Void> ok() {
        return new Result<>(StatusCode.OK, null, null);
    }

    public static <T> Result<T> failure(StatusCode code, String message) {
        Objects.requireNonNull(code, "code");
        if (code == StatusCode.OK) {
            throw new IllegalArgumentException("A failure cannot carry status OK");
        }
        return new Result<>(code, null, message);
    }

    public static <T> Result<T> invalidArgument(String message) {
        return failure(StatusCode.INVALID_ARGUMENT, message);
    }

    public static <T> Result<T> notFound(String message) {
        return failure(StatusCode.NOT_FOUND, message);
    }

    public static <T> Result<T> unavailable(String message) {
        return failure(StatusCode.UNAVAILABLE, message);
    }

    /** Re-types a failure so it can be propagated from a method with a different value type. */
    public <U> Result<U> propagate() {
        if (isSuccess()) {
            throw new IllegalStateException("Cannot propagate a successful result");
        }
        return new Result<>(code, null, message);
    }

    public boolean isSuccess() {
        return code == StatusCode.OK;
    }

    public boolean isFailure() {
        return code != StatusCode.OK;
    }

    public StatusCode getCode() {
        return code;
    }

    public T getValue() {
        if (isFailure()) {
            throw new IllegalStateException("No value on failed result: " + this);
        }
        return value;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "Result.success(" + value + ")";
        }
        return "Result.failure(" + code + ": " + message + ")";
    }
}
