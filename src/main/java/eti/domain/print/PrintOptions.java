package eti.domain.print;

import com.google.common.base.Preconditions;
import eti.common.SgdConstants;
import eti.dal.WorkflowConfig;
import eti.domain.readiness.ReadinessOptions;

/**
 * Options for a single print job
 * @since 16/10/2026
 */
public record PrintOptions(
        int maxAttempts,
        long retryDelayMs,
        long maxRetryDelayMs,
        boolean checkStatus,
        boolean autoCorrect,
        ReadinessOptions readinessOptions,
        boolean waitForCompletion,
        long maxWaitMs,
        int maxDataSize,
        boolean allowUndeterminedLanguage,
        boolean flushAfterSend) {

    public static final long DEFAULT_RETRY_DELAY_MS = 2000;
    public static final long DEFAULT_MAX_RETRY_DELAY_MS = 30000;
    public static final long DEFAULT_MAX_WAIT_MS = 60000;

    public PrintOptions {
        Preconditions.checkArgument(maxAttempts >= 1, "maxAttempts must be at least 1");
        Preconditions.checkArgument(retryDelayMs >= 0, "retryDelayMs must not be negative");
        Preconditions.checkArgument(maxDataSize > 0, "maxDataSize must be positive");
        readinessOptions = readinessOptions != null ? readinessOptions : ReadinessOptions.forPrinting();
    }

    public static PrintOptions defaults() {
        return new PrintOptions(3, DEFAULT_RETRY_DELAY_MS, DEFAULT_MAX_RETRY_DELAY_MS, true, true,
                ReadinessOptions.forPrinting(), true, DEFAULT_MAX_WAIT_MS, SgdConstants.MAX_DATA_SIZE, false, false);
    }

    public static PrintOptions fromConfig(WorkflowConfig config) {
        return new PrintOptions(config.maxAttempts(), config.retryDelayMs(), config.maxRetryDelayMs(),
                true, config.autoCorrect(), ReadinessOptions.forPrinting(), config.waitForCompletion(),
                config.maxWaitMs(), config.maxDataSize(), false, false);
    }

    public PrintOptions withMaxAttempts(int attempts) {
        return new PrintOptions(attempts, retryDelayMs, maxRetryDelayMs, checkStatus, autoCorrect, readinessOptions,
                waitForCompletion, maxWaitMs, maxDataSize, allowUndeterminedLanguage, flushAfterSend);
    }

    public PrintOptions withReadinessOptions(ReadinessOptions options) {
        return new PrintOptions(maxAttempts, retryDelayMs, maxRetryDelayMs, checkStatus, autoCorrect, options,
                waitForCompletion, maxWaitMs, maxDataSize, allowUndeterminedLanguage, flushAfterSend);
    }

    public PrintOptions withWaitForCompletion(boolean wait) {
        return new PrintOptions(maxAttempts, retryDelayMs, maxRetryDelayMs, checkStatus, autoCorrect, readinessOptions,
                wait, maxWaitMs, maxDataSize, allowUndeterminedLanguage, flushAfterSend);
    }

    public PrintOptions withCheckStatus(boolean check) {
        return new PrintOptions(maxAttempts, retryDelayMs, maxRetryDelayMs, check, autoCorrect, readinessOptions,
                waitForCompletion, maxWaitMs, maxDataSize, allowUndeterminedLanguage, flushAfterSend);
    }

    public PrintOptions withAllowUndeterminedLanguage(boolean allow) {
        return new PrintOptions(maxAttempts, retryDelayMs, maxRetryDelayMs, checkStatus, autoCorrect, readinessOptions,
                waitForCompletion, maxWaitMs, maxDataSize, allow, flushAfterSend);
    }

    /**
     * Delay before the given retry, growing linearly and capped
     */
    public long retryDelayFor(int attempt) {
        long delay = retryDelayMs * attempt;
        return maxRetryDelayMs > 0 ? Math.min(delay, maxRetryDelayMs) : delay;
    }
}
