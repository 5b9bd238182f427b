package eti.domain.protocol;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Decoded host status response
 * @since 14/10/2026
 */
public final class HostStatusInfo {
    // Positional flag fields
    public static final int FIELD_PAPER_OUT = 1;
    public static final int FIELD_RIBBON_OUT = 2;
    public static final int FIELD_HEAD_OPEN = 3;
    public static final int FIELD_HEAD_COLD = 4;
    public static final int FIELD_HEAD_TOO_HOT = 5;

    private final boolean ok;
    private final Integer errorCode;
    private final String errorMessage;
    private final Map<Integer, String> fields;

    public HostStatusInfo(boolean ok, Integer errorCode, String errorMessage, Map<Integer, String> fields) {
        this.ok = ok;
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
        this.fields = fields != null ? ImmutableMap.copyOf(fields) : ImmutableMap.of();
    }

    public boolean isOk() {
        return ok;
    }

    /**
     * Primary numeric code, {@code null} for free-text responses
     */
    public Integer getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * Raw positional fields, keyed by position
     */
    public Map<Integer, String> getFields() {
        return fields;
    }

    public boolean isPaperOut() {
        return isFlagSet(FIELD_PAPER_OUT);
    }

    public boolean isRibbonOut() {
        return isFlagSet(FIELD_RIBBON_OUT);
    }

    public boolean isHeadOpen() {
        return isFlagSet(FIELD_HEAD_OPEN);
    }

    public boolean isHeadCold() {
        return isFlagSet(FIELD_HEAD_COLD);
    }

    public boolean isHeadTooHot() {
        return isFlagSet(FIELD_HEAD_TOO_HOT);
    }

    // Absent fields are not set
    private boolean isFlagSet(int position) {
        String value = fields.get(position);
        if (value == null) {
            return false;
        }
        try {
            return Integer.parseInt(value.trim()) == 1;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return String.format("HostStatusInfo{ok=%s, errorCode=%s, errorMessage='%s'}", ok, errorCode, errorMessage);
    }
}
