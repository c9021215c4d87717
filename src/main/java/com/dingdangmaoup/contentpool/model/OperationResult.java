package com.dingdangmaoup.contentpool.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a pool operation. Expected failures (validation, storage, corrupt data)
 * are reported here instead of being thrown; a failed result always carries at least
 * one non-blank error message.
 *
 * @param <T> payload type
 */
public final class OperationResult<T> {

    private static final String UNKNOWN_ERROR = "Unknown error";

    private final boolean success;
    private final T data;
    private final List<String> errors;

    private OperationResult(boolean success, T data, List<String> errors) {
        this.success = success;
        this.data = data;
        this.errors = Collections.unmodifiableList(errors);
    }

    public static <T> OperationResult<T> success(T data) {
        return new OperationResult<>(true, data, List.of());
    }

    public static <T> OperationResult<T> failure(String error) {
        return failure(error == null ? List.of() : List.of(error));
    }

    public static <T> OperationResult<T> failure(List<String> errors) {
        List<String> cleaned = new ArrayList<>();
        if (errors != null) {
            for (String error : errors) {
                if (error != null && !error.isBlank()) {
                    cleaned.add(error);
                }
            }
        }
        if (cleaned.isEmpty()) {
            cleaned.add(UNKNOWN_ERROR);
        }
        return new OperationResult<>(false, null, cleaned);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public T getData() {
        return data;
    }

    public List<String> getErrors() {
        return errors;
    }

    public String firstError() {
        return errors.isEmpty() ? null : errors.get(0);
    }

    /**
     * All error messages joined for display
     */
    public String allErrors() {
        return String.join(", ", errors);
    }

    @Override
    public String toString() {
        return success ? "OperationResult[success, data=" + data + "]"
                : "OperationResult[failure, errors=" + errors + "]";
    }
}
