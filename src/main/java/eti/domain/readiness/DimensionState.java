package eti.domain.readiness;

import eti.domain.ErrorInfo;
import eti.domain.protocol.HostStatusInfo;

/**
 * Cached outcome of one readiness dimension
 * @since 15/10/2026
 */
public final class DimensionState {
    private static final DimensionState UNCHECKED = new DimensionState(EDimensionStatus.UNCHECKED, null, null, null, null);

    private final EDimensionStatus status;
    private final String value;
    private final String detail;
    private final ErrorInfo error;
    private final HostStatusInfo hostStatus;

    private DimensionState(EDimensionStatus status, String value, String detail,
                           ErrorInfo error, HostStatusInfo hostStatus) {
        this.status = status;
        this.value = value;
        this.detail = detail;
        this.error = error;
        this.hostStatus = hostStatus;
    }

    public static DimensionState unchecked() {
        return UNCHECKED;
    }

    public static DimensionState good(String value) {
        return new DimensionState(EDimensionStatus.GOOD, value, null, null, null);
    }

    public static DimensionState bad(String value, String detail) {
        return new DimensionState(EDimensionStatus.BAD, value, detail, null, null);
    }

    /**
     * The query itself failed; the transport error is kept as-is
     */
    public static DimensionState failed(ErrorInfo error) {
        return new DimensionState(EDimensionStatus.BAD, null, error.getMessage(), error, null);
    }

    public static DimensionState host(String value, HostStatusInfo hostStatus) {
        boolean healthy = hostStatus.isOk() && !hostStatus.isPaperOut() && !hostStatus.isRibbonOut()
                && !hostStatus.isHeadOpen() && !hostStatus.isHeadCold() && !hostStatus.isHeadTooHot();
        EDimensionStatus status = healthy ? EDimensionStatus.GOOD : EDimensionStatus.BAD;
        String detail = healthy ? null
                : hostStatus.getErrorMessage() != null ? hostStatus.getErrorMessage() : "Printer reports a fault";
        return new DimensionState(status, value, detail, null, hostStatus);
    }

    public EDimensionStatus getStatus() {
        return status;
    }

    public boolean isChecked() {
        return status != EDimensionStatus.UNCHECKED;
    }

    public boolean isGood() {
        return status == EDimensionStatus.GOOD;
    }

    public boolean isBad() {
        return status == EDimensionStatus.BAD;
    }

    public boolean isQueryFailed() {
        return error != null;
    }

    /**
     * Parsed response value, if any
     */
    public String getValue() {
        return value;
    }

    public String getDetail() {
        return detail;
    }

    public ErrorInfo getError() {
        return error;
    }

    public HostStatusInfo getHostStatus() {
        return hostStatus;
    }

    @Override
    public String toString() {
        return switch (status) {
            case UNCHECKED -> "Unchecked";
            case GOOD -> "Good(" + value + ")";
            case BAD -> "Bad(" + detail + ")";
        };
    }
}
