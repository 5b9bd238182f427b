package eti.domain.print;

/**
 * @since 16/10/2026
 */
public enum EPrintEventType {
    STEP_CHANGED,
    PROGRESS_UPDATE,
    ERROR_OCCURRED,
    RETRY_ATTEMPT,
    STATUS_UPDATE,
    COMPLETED,
    CANCELLED
}
