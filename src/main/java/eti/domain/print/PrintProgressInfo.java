package eti.domain.print;

import java.time.Duration;

/**
 * @since 16/10/2026
 */
public record PrintProgressInfo(
        double progress,
        String currentOperation,
        Duration elapsed,
        Duration estimatedRemaining) {
}
