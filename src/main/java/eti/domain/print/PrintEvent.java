package eti.domain.print;

/**
 * Workflow event. The payload accessor matching {@link #getType()} is non-null; the others are null.
 * @since 16/10/2026
 */
public final class PrintEvent {
    private final EPrintEventType type;
    private final long timestamp;
    private final Object payload;

    private PrintEvent(EPrintEventType type, Object payload) {
        this.type = type;
        this.timestamp = System.currentTimeMillis();
        this.payload = payload;
    }

    public static PrintEvent stepChanged(PrintStepInfo info) {
        return new PrintEvent(EPrintEventType.STEP_CHANGED, info);
    }

    public static PrintEvent progressUpdate(PrintProgressInfo info) {
        return new PrintEvent(EPrintEventType.PROGRESS_UPDATE, info);
    }

    public static PrintEvent errorOccurred(PrintErrorInfo info) {
        return new PrintEvent(EPrintEventType.ERROR_OCCURRED, info);
    }

    public static PrintEvent retryAttempt(RetryAttemptInfo info) {
        return new PrintEvent(EPrintEventType.RETRY_ATTEMPT, info);
    }

    public static PrintEvent statusUpdate(StatusUpdateInfo info) {
        return new PrintEvent(EPrintEventType.STATUS_UPDATE, info);
    }

    public static PrintEvent completed(PrintStepInfo info) {
        return new PrintEvent(EPrintEventType.COMPLETED, info);
    }

    public static PrintEvent cancelled(PrintStepInfo info) {
        return new PrintEvent(EPrintEventType.CANCELLED, info);
    }

    public EPrintEventType getType() {
        return type;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public boolean isTerminal() {
        return type == EPrintEventType.COMPLETED || type == EPrintEventType.CANCELLED;
    }

    /**
     * Step info for step-changed, completed and cancelled events
     */
    public PrintStepInfo getStepInfo() {
        return payload instanceof PrintStepInfo info ? info : null;
    }

    public PrintProgressInfo getProgressInfo() {
        return payload instanceof PrintProgressInfo info ? info : null;
    }

    public PrintErrorInfo getErrorInfo() {
        return payload instanceof PrintErrorInfo info ? info : null;
    }

    public RetryAttemptInfo getRetryInfo() {
        return payload instanceof RetryAttemptInfo info ? info : null;
    }

    public StatusUpdateInfo getStatusInfo() {
        return payload instanceof StatusUpdateInfo info ? info : null;
    }

    @Override
    public String toString() {
        return "PrintEvent{" + type + ", " + payload + "}";
    }
}
