package eti.domain.policy;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Retry configuration.
 * A {@code delayMs} of 0 retries immediately; a {@code maxDelayMs} of 0 leaves the backoff uncapped.
 *
 * @since 15/10/2026
 */
public record RetryPolicyConfig(
        int maxAttempts,
        long delayMs,
        long maxDelayMs,
        double backoffMultiplier,
        boolean retryOnTimeout,
        boolean retryOnException,
        List<Class<? extends Exception>> retryOnExceptionTypes) {

    public RetryPolicyConfig {
        Preconditions.checkArgument(maxAttempts >= 0, "maxAttempts must not be negative");
        Preconditions.checkArgument(delayMs >= 0, "delayMs must not be negative");
        Preconditions.checkArgument(maxDelayMs >= 0, "maxDelayMs must not be negative");
        Preconditions.checkArgument(backoffMultiplier >= 1.0, "backoffMultiplier must be at least 1.0");
        retryOnExceptionTypes = retryOnExceptionTypes != null
                ? ImmutableList.copyOf(retryOnExceptionTypes) : ImmutableList.of();
    }

    public static RetryPolicyConfig defaults() {
        return new RetryPolicyConfig(3, 0, 0, 2.0, true, true, null);
    }

    public static RetryPolicyConfig withBackoff(int maxAttempts, long delayMs, long maxDelayMs, double multiplier) {
        return new RetryPolicyConfig(maxAttempts, delayMs, maxDelayMs, multiplier, true, true, null);
    }

    public static RetryPolicyConfig noRetry() {
        return new RetryPolicyConfig(1, 0, 0, 1.0, false, false, null);
    }

    public RetryPolicyConfig withRetryOn(List<Class<? extends Exception>> types) {
        return new RetryPolicyConfig(maxAttempts, delayMs, maxDelayMs, backoffMultiplier,
                retryOnTimeout, retryOnException, types);
    }

    public RetryPolicyConfig withRetryOnTimeout(boolean enabled) {
        return new RetryPolicyConfig(maxAttempts, delayMs, maxDelayMs, backoffMultiplier,
                enabled, retryOnException, retryOnExceptionTypes);
    }

    public RetryPolicyConfig withRetryOnException(boolean enabled) {
        return new RetryPolicyConfig(maxAttempts, delayMs, maxDelayMs, backoffMultiplier,
                retryOnTimeout, enabled, retryOnExceptionTypes);
    }
}
