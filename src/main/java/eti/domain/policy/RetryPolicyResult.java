package eti.domain.policy;

import java.time.Duration;

/**
 * Outcome of a retried operation
 * @since 15/10/2026
 */
public final class RetryPolicyResult<T> {
    private final boolean success;
    private final T data;
    private final int attempts;
    private final String errorMessage;
    private final Throwable lastError;
    private final Duration totalDuration;

    private RetryPolicyResult(boolean success, T data, int attempts, String errorMessage,
                              Throwable lastError, Duration totalDuration) {
        this.success = success;
        this.data = data;
        this.attempts = attempts;
        this.errorMessage = errorMessage;
        this.lastError = lastError;
        this.totalDuration = totalDuration;
    }

    static <T> RetryPolicyResult<T> success(T data, int attempts, Duration totalDuration) {
        return new RetryPolicyResult<>(true, data, attempts, null, null, totalDuration);
    }

    static <T> RetryPolicyResult<T> failure(String errorMessage, Throwable lastError, int attempts, Duration totalDuration) {
        return new RetryPolicyResult<>(false, null, attempts, errorMessage, lastError, totalDuration);
    }

    public boolean isSuccess() {
        return success;
    }

    public T getData() {
        return data;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Throwable getLastError() {
        return lastError;
    }

    public Duration getTotalDuration() {
        return totalDuration;
    }

    @Override
    public String toString() {
        return String.format("RetryPolicyResult{success=%s, attempts=%d, duration=%dms, error='%s'}",
                success, attempts, totalDuration.toMillis(), errorMessage);
    }
}
