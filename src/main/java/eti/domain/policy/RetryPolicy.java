package eti.domain.policy;

import com.google.common.base.Stopwatch;
import eti.domain.ErrorCode;
import eti.domain.ErrorInfo;
import eti.domain.ISleeper;
import eti.domain.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketTimeoutException;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Bounded retry executor with geometric backoff
 * @since 15/10/2026
 */
public class RetryPolicy {
    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    private final RetryPolicyConfig config;
    private final ISleeper sleeper;

    public RetryPolicy(RetryPolicyConfig config) {
        this(config, ISleeper.SYSTEM);
    }

    public RetryPolicy(RetryPolicyConfig config, ISleeper sleeper) {
        this.config = config;
        this.sleeper = sleeper;
    }

    public RetryPolicyConfig getConfig() {
        return config;
    }

    /**
     * Run the operation until it succeeds, a failure is not retry-eligible, or attempts run out
     */
    public <T> RetryPolicyResult<T> execute(Callable<T> operation) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        if (config.maxAttempts() == 0) {
            return RetryPolicyResult.failure("No attempts allowed", null, 0, stopwatch.elapsed());
        }

        Exception lastError = null;
        int attempt = 0;
        while (attempt < config.maxAttempts()) {
            attempt++;
            try {
                T value = operation.call();
                if (attempt > 1) {
                    logger.info("Operation succeeded on attempt {}/{}", attempt, config.maxAttempts());
                }
                return RetryPolicyResult.success(value, attempt, stopwatch.elapsed());
            } catch (Exception e) {
                lastError = e;
                logger.warn("Attempt {}/{} failed: {}", attempt, config.maxAttempts(), e.getMessage());

                if (!shouldRetry(e) || attempt >= config.maxAttempts()) {
                    break;
                }
                if (!pause(attempt)) {
                    return RetryPolicyResult.failure("Retry interrupted", e, attempt, stopwatch.elapsed());
                }
            }
        }

        String message = lastError != null && lastError.getMessage() != null
                ? lastError.getMessage() : String.valueOf(lastError);
        return RetryPolicyResult.failure(message, lastError, attempt, stopwatch.elapsed());
    }

    /**
     * Retry a result-returning operation. Failed results are forwarded unchanged once attempts run out.
     */
    public <T> Result<T> executeWithResult(Supplier<Result<T>> operation) {
        if (config.maxAttempts() == 0) {
            return Result.failure(ErrorCode.RETRY_LIMIT_EXCEEDED, 0);
        }

        Result<T> last = null;
        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            last = operation.get();
            if (last.isSuccess()) {
                return last;
            }
            logger.warn("Attempt {}/{} failed: {}", attempt, config.maxAttempts(), last.getError().getMessage());

            if (!shouldRetry(last.getError()) || attempt >= config.maxAttempts()) {
                break;
            }
            if (!pause(attempt)) {
                return Result.failure(ErrorCode.OPERATION_CANCELLED);
            }
        }
        return last;
    }

    /**
     * Delay before the attempt following {@code attempt}
     */
    public long delayFor(int attempt) {
        if (config.delayMs() <= 0) {
            return 0;
        }
        double delay = config.delayMs() * Math.pow(config.backoffMultiplier(), Math.max(0, attempt - 1));
        if (config.maxDelayMs() > 0) {
            delay = Math.min(delay, config.maxDelayMs());
        }
        return (long) delay;
    }

    boolean shouldRetry(Exception e) {
        if (isTimeout(e)) {
            return config.retryOnTimeout();
        }
        if (!config.retryOnException()) {
            return false;
        }
        if (config.retryOnExceptionTypes().isEmpty()) {
            return true;
        }
        return config.retryOnExceptionTypes().stream().anyMatch(type -> type.isInstance(e));
    }

    boolean shouldRetry(ErrorInfo error) {
        if (error.is(ErrorCode.OPERATION_CANCELLED)) {
            return false;
        }
        if (error.is(ErrorCode.OPERATION_TIMEOUT) || error.is(ErrorCode.STATUS_TIMEOUT)
                || error.is(ErrorCode.CONNECTION_TIMEOUT) || error.is(ErrorCode.PRINT_TIMEOUT)) {
            return config.retryOnTimeout();
        }
        if (!config.retryOnException()) {
            return false;
        }
        Throwable cause = error.getCause();
        if (config.retryOnExceptionTypes().isEmpty()) {
            return true;
        }
        return cause != null && config.retryOnExceptionTypes().stream().anyMatch(type -> type.isInstance(cause));
    }

    private static boolean isTimeout(Exception e) {
        return e instanceof TimeoutException || e instanceof SocketTimeoutException;
    }

    private boolean pause(int attempt) {
        long delay = delayFor(attempt);
        if (delay <= 0) {
            return true;
        }
        logger.debug("Waiting {}ms before attempt {}", delay, attempt + 1);
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Retry wait interrupted");
            return false;
        }
    }
}
