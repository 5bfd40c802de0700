package com.streamfirst.nomicon.domain;

import java.util.Optional;
import java.util.function.Function;
import lombok.EqualsAndHashCode;
import lombok.NonNull;

/**
 * Either a value or an error message with an error code. Used by hosts that report failures as
 * diagnostics instead of catching exceptions.
 *
 * @param <T> the type of data returned on success
 */
@EqualsAndHashCode
public final class Result<T> {

    private final boolean success;
    private final T data;
    private final String errorMessage;
    private final String errorCode;

    private Result(boolean success, T data, String errorMessage, String errorCode) {
        this.success = success;
        this.data = data;
        this.errorMessage = errorMessage;
        this.errorCode = errorCode;
    }

    /**
     * Creates a successful result.
     */
    public static <T> Result<T> success(@NonNull T data) {
        return new Result<>(true, data, null, null);
    }

    /**
     * Creates a failure carrying the exception's message unchanged and its error code.
     */
    public static <T> Result<T> failure(@NonNull NamingException error) {
        return new Result<>(false, null, error.getMessage(), error.errorCode());
    }

    /**
     * Creates a failure with an explicit message and code.
     */
    public static <T> Result<T> failure(@NonNull String errorMessage, @NonNull String errorCode) {
        return new Result<>(false, null, errorMessage, errorCode);
    }

    /**
     * Returns the data if successful, or throws an {@link IllegalStateException} describing the
     * failure.
     */
    public T orElseThrow() {
        if (success) {
            return data;
        }
        throw new IllegalStateException(errorMessage + " (code: " + errorCode + ")");
    }

    /**
     * Maps the data if successful, preserving a failure as is.
     */
    public <U> Result<U> map(Function<T, U> mapper) {
        if (success) {
            return Result.success(mapper.apply(data));
        }
        return new Result<>(false, null, errorMessage, errorCode);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public Optional<T> getData() {
        return success ? Optional.of(data) : Optional.empty();
    }

    public Optional<String> getErrorMessage() {
        return success ? Optional.empty() : Optional.of(errorMessage);
    }

    public Optional<String> getErrorCode() {
        return success ? Optional.empty() : Optional.of(errorCode);
    }

    @Override
    public String toString() {
        if (success) {
            return "Result.success(" + data + ")";
        }
        return "Result.failure(" + errorMessage + ", code=" + errorCode + ")";
    }
}
