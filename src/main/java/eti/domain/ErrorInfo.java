package eti.domain;

import java.util.Objects;

/**
 * Structured error carried by a failed {@link Result}
 * @since 14/10/2026
 */
public final class ErrorInfo {
    private final String code;
    private final EErrorCategory category;
    private final String message;
    private final String recoveryHint;
    private final long timestamp;
    private final Throwable cause;

    public ErrorInfo(String code, EErrorCategory category, String message,
                     String recoveryHint, long timestamp, Throwable cause) {
        this.code = Objects.requireNonNull(code, "code");
        this.category = Objects.requireNonNull(category, "category");
        this.message = message != null ? message : "";
        this.recoveryHint = recoveryHint;
        this.timestamp = timestamp;
        this.cause = cause;
    }

    public static ErrorInfo of(ErrorCode errorCode, Object... args) {
        return new ErrorInfo(errorCode.name(), errorCode.getCategory(), errorCode.format(args),
                errorCode.getRecoveryHint(), System.currentTimeMillis(), null);
    }

    public static ErrorInfo of(ErrorCode errorCode, Throwable cause, Object... args) {
        return new ErrorInfo(errorCode.name(), errorCode.getCategory(), errorCode.format(args),
                errorCode.getRecoveryHint(), System.currentTimeMillis(), cause);
    }

    /**
     * Same code and category with a custom message
     */
    public static ErrorInfo withMessage(ErrorCode errorCode, String message) {
        return new ErrorInfo(errorCode.name(), errorCode.getCategory(), message,
                errorCode.getRecoveryHint(), System.currentTimeMillis(), null);
    }

    public String getCode() {
        return code;
    }

    public EErrorCategory getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }

    public String getRecoveryHint() {
        return recoveryHint;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public Throwable getCause() {
        return cause;
    }

    public boolean is(ErrorCode errorCode) {
        return code.equals(errorCode.name());
    }

    @Override
    public String toString() {
        return String.format("ErrorInfo{code=%s, category=%s, message='%s'}", code, category, message);
    }
}
