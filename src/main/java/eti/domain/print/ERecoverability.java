package eti.domain.print;

/**
 * @since 16/10/2026
 */
public enum ERecoverability {
    RECOVERABLE,           // Retrying is expected to help
    POSSIBLY_RECOVERABLE,  // Retrying may help, e.g. after a correction or user action
    NON_RECOVERABLE,       // Retrying will not help
    UNKNOWN;

    public boolean isRetryable() {
        return this == RECOVERABLE || this == POSSIBLY_RECOVERABLE;
    }
}
