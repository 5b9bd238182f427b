package eti.domain;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an operation: either data or an error, never both
 * @since 14/10/2026
 */
public final class Result<T> {
    private final boolean success;
    private final T data;
    private final ErrorInfo error;

    private Result(boolean success, T data, ErrorInfo error) {
        this.success = success;
        this.data = data;
        this.error = error;
    }

    public static <T> Result<T> success(T data) {
        return new Result<>(true, data, null);
    }

    public static Result<Void> success() {
        return new Result<>(true, null, null);
    }

    public static <T> Result<T> failure(ErrorInfo error) {
        return new Result<>(false, null, Objects.requireNonNull(error, "error"));
    }

    public static <T> Result<T> failure(ErrorCode errorCode, Object... args) {
        return failure(ErrorInfo.of(errorCode, args));
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

    public ErrorInfo getError() {
        return error;
    }

    public T getOrElse(T fallback) {
        return success ? data : fallback;
    }

    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (!success) {
            return propagate();
        }
        return Result.success(mapper.apply(data));
    }

    /**
     * Forward this failure unchanged under another value type
     */
    public <U> Result<U> propagate() {
        if (success) {
            throw new IllegalStateException("Cannot propagate a successful result");
        }
        return new Result<>(false, null, error);
    }

    @Override
    public String toString() {
        return success ? "Result{success, data=" + data + "}" : "Result{failure, error=" + error + "}";
    }
}
