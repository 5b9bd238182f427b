package eti.domain.policy;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import eti.domain.ErrorCode;
import eti.domain.ErrorInfo;
import eti.domain.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Bounds the wall-clock duration of a single call
 * @since 15/10/2026
 */
public class TimeoutPolicy {
    private static final Logger logger = LoggerFactory.getLogger(TimeoutPolicy.class);

    private final ExecutorService executor;

    public TimeoutPolicy() {
        this(Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("etiketa-io-%d")
                .setDaemon(true)
                .build()));
    }

    public TimeoutPolicy(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Run the operation, failing with {@link TimeoutException} if it does not finish in time
     */
    public <T> T execute(Callable<T> operation, long timeoutMs) throws Exception {
        if (timeoutMs <= 0) {
            throw new TimeoutException("Operation timed out after " + timeoutMs + "ms");
        }
        Future<T> future = executor.submit(operation);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException("Operation timed out after " + timeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        }
    }

    /**
     * Result-returning variant: a timeout becomes {@code OPERATION_TIMEOUT}, anything unexpected {@code OPERATION_ERROR}
     */
    public <T> Result<T> executeWithResult(Supplier<Result<T>> operation, long timeoutMs) {
        if (timeoutMs <= 0) {
            return Result.failure(ErrorCode.OPERATION_TIMEOUT, timeoutMs);
        }
        Future<Result<T>> future = executor.submit(operation::get);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Operation timed out after {}ms", timeoutMs);
            return Result.failure(ErrorInfo.of(ErrorCode.OPERATION_TIMEOUT, e, timeoutMs));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Operation failed unexpectedly: {}", cause.getMessage());
            return Result.failure(ErrorInfo.of(ErrorCode.OPERATION_ERROR, cause, cause.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return Result.failure(ErrorCode.OPERATION_CANCELLED);
        }
    }

    public void shutdown() {
        executor.shutdownNow();
    }
}
