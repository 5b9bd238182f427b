package eti.domain.correction;

import com.google.common.base.Preconditions;

/**
 * Corrections the auto-corrector is permitted to apply
 * @since 15/10/2026
 */
public record AutoCorrectionOptions(
        boolean enableUnpause,
        boolean enableClearErrors,
        boolean enableCalibration,
        boolean enableLanguageSwitch,
        boolean enableBufferClear,
        int maxAttempts,
        long attemptDelayMs) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_ATTEMPT_DELAY_MS = 500;

    public AutoCorrectionOptions {
        Preconditions.checkArgument(maxAttempts >= 1, "maxAttempts must be at least 1");
        Preconditions.checkArgument(attemptDelayMs >= 0, "attemptDelayMs must not be negative");
    }

    public static AutoCorrectionOptions all() {
        return new AutoCorrectionOptions(true, true, true, true, true, DEFAULT_MAX_ATTEMPTS, DEFAULT_ATTEMPT_DELAY_MS);
    }

    public static AutoCorrectionOptions none() {
        return new AutoCorrectionOptions(false, false, false, false, false, DEFAULT_MAX_ATTEMPTS, DEFAULT_ATTEMPT_DELAY_MS);
    }

    /**
     * Unpause only
     */
    public static AutoCorrectionOptions safe() {
        return new AutoCorrectionOptions(true, false, false, false, false, DEFAULT_MAX_ATTEMPTS, DEFAULT_ATTEMPT_DELAY_MS);
    }

    public static AutoCorrectionOptions print() {
        return new AutoCorrectionOptions(true, true, false, true, false, DEFAULT_MAX_ATTEMPTS, DEFAULT_ATTEMPT_DELAY_MS);
    }

    public static AutoCorrectionOptions autoPrint() {
        return new AutoCorrectionOptions(true, true, false, true, true, DEFAULT_MAX_ATTEMPTS, DEFAULT_ATTEMPT_DELAY_MS);
    }

    public boolean hasAnyEnabled() {
        return enableUnpause || enableClearErrors || enableCalibration || enableLanguageSwitch || enableBufferClear;
    }
}
