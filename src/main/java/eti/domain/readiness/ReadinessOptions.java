package eti.domain.readiness;

import com.google.common.base.Preconditions;
import eti.domain.correction.AutoCorrectionOptions;

/**
 * Which readiness dimensions to check and which faults may be fixed
 * @since 15/10/2026
 */
public record ReadinessOptions(
        boolean checkConnection,
        boolean checkMedia,
        boolean checkHead,
        boolean checkPause,
        boolean checkErrors,
        boolean checkLanguage,
        boolean fixPausedPrinter,
        boolean fixPrinterErrors,
        boolean fixMediaCalibration,
        boolean fixLanguageMismatch,
        boolean clearBuffer,
        int maxAttempts,
        long checkDelayMs) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_CHECK_DELAY_MS = 100;

    public ReadinessOptions {
        Preconditions.checkArgument(maxAttempts >= 1, "maxAttempts must be at least 1");
        Preconditions.checkArgument(checkDelayMs >= 0, "checkDelayMs must not be negative");
    }

    /**
     * Connection only
     */
    public static ReadinessOptions quick() {
        return new ReadinessOptions(true, false, false, false, false, false,
                false, false, false, false, false, DEFAULT_MAX_ATTEMPTS, DEFAULT_CHECK_DELAY_MS);
    }

    /**
     * Every check, no fixes
     */
    public static ReadinessOptions comprehensive() {
        return new ReadinessOptions(true, true, true, true, true, true,
                false, false, false, false, false, DEFAULT_MAX_ATTEMPTS, DEFAULT_CHECK_DELAY_MS);
    }

    /**
     * Every check with the fixes that are safe before a print job
     */
    public static ReadinessOptions forPrinting() {
        return new ReadinessOptions(true, true, true, true, true, true,
                true, true, false, true, false, DEFAULT_MAX_ATTEMPTS, DEFAULT_CHECK_DELAY_MS);
    }

    /**
     * Every check and every fix except calibration
     */
    public static ReadinessOptions smartOptimized() {
        return new ReadinessOptions(true, true, true, true, true, true,
                true, true, false, true, true, DEFAULT_MAX_ATTEMPTS, DEFAULT_CHECK_DELAY_MS);
    }

    public boolean isChecked(EReadinessDimension dimension) {
        return switch (dimension) {
            case CONNECTION -> checkConnection;
            case MEDIA -> checkMedia;
            case HEAD -> checkHead;
            case PAUSE -> checkPause;
            case HOST_ERRORS -> checkErrors;
            case LANGUAGE -> checkLanguage;
        };
    }

    public boolean hasAnyFix() {
        return fixPausedPrinter || fixPrinterErrors || fixMediaCalibration || fixLanguageMismatch || clearBuffer;
    }

    public ReadinessOptions withCheckDelayMs(long delayMs) {
        return new ReadinessOptions(checkConnection, checkMedia, checkHead, checkPause, checkErrors, checkLanguage,
                fixPausedPrinter, fixPrinterErrors, fixMediaCalibration, fixLanguageMismatch, clearBuffer,
                maxAttempts, delayMs);
    }

    public AutoCorrectionOptions toCorrectionOptions() {
        return new AutoCorrectionOptions(fixPausedPrinter, fixPrinterErrors, fixMediaCalibration,
                fixLanguageMismatch, clearBuffer, maxAttempts, checkDelayMs);
    }
}
