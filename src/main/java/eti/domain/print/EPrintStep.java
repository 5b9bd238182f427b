package eti.domain.print;

/**
 * Print workflow steps with their fixed progress fractions
 * @since 16/10/2026
 */
public enum EPrintStep {
    INITIALIZING(0.0),
    VALIDATING(0.1),
    CONNECTING(0.2),
    CONNECTED(0.3),
    CHECKING_STATUS(0.4),
    SENDING(0.6),
    WAITING_FOR_COMPLETION(0.8),
    COMPLETED(1.0),
    FAILED(-1),      // Keeps the last progress
    CANCELLED(-1);   // Keeps the last progress

    private final double progress;

    EPrintStep(double progress) {
        this.progress = progress;
    }

    /**
     * Progress fraction for this step, or -1 when the previous progress is kept
     */
    public double getProgress() {
        return progress;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
