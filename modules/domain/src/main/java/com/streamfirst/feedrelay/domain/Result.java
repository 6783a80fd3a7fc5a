package com.streamfirst.feedrelay.domain;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.Optional;

/**
 * Generic result type that represents either success with optional data or failure with error.
 * Used for probe outcomes where a failure is a health signal rather than an exception.
 *
 * @param <T> the type of data returned on success
 */
@Value
@EqualsAndHashCode
public class Result<T> {

    boolean success;
    T data;
    String errorMessage;

    private Result(boolean success, T data, String errorMessage) {
        this.success = success;
        this.data = data;
        this.errorMessage = errorMessage;
    }

    /**
     * Creates a successful result carrying data, which may be null when the probe has nothing to add.
     */
    public static <T> Result<T> success(T data) {
        return new Result<>(true, data, null);
    }

    /**
     * Creates a successful result without data (for void probes).
     */
    public static Result<Void> success() {
        return new Result<>(true, null, null);
    }

    /**
     * Creates a failure result with error message.
     */
    public static <T> Result<T> failure(String errorMessage) {
        return new Result<>(false, null, errorMessage);
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * Gets the data if successful, empty otherwise.
     */
    public Optional<T> getData() {
        return success ? Optional.ofNullable(data) : Optional.empty();
    }

    /**
     * Gets the error message if failed, empty otherwise.
     */
    public Optional<String> getErrorMessage() {
        return success ? Optional.empty() : Optional.ofNullable(errorMessage);
    }

    @Override
    public String toString() {
        if (success) {
            return "Result.success(" + data + ")";
        }
        return "Result.failure(" + errorMessage + ")";
    }
}
