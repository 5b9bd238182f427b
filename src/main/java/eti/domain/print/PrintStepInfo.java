package eti.domain.print;

import com.google.common.collect.ImmutableMap;

import java.time.Duration;
import java.util.Map;

/**
 * @since 16/10/2026
 */
public record PrintStepInfo(
        EPrintStep step,
        String message,
        int attempt,
        int maxAttempts,
        Duration elapsed,
        double progress,
        Map<String, Object> metadata) {

    public PrintStepInfo {
        metadata = metadata != null ? ImmutableMap.copyOf(metadata) : ImmutableMap.of();
    }
}
