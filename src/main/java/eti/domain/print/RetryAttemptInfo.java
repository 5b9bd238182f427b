package eti.domain.print;

/**
 * @since 16/10/2026
 */
public record RetryAttemptInfo(int attempt, int maxAttempts, long delayMs, String reason) {
}
