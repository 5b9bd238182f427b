package eti.domain.print;

import eti.domain.ErrorCode;
import eti.domain.ErrorInfo;

import java.util.Locale;

/**
 * Maps errors to a recoverability class and a display-ready hint
 * @since 16/10/2026
 */
public final class ErrorClassifier {
    private ErrorClassifier() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static ERecoverability classify(ErrorInfo error) {
        if (error.is(ErrorCode.OPERATION_CANCELLED)) {
            return ERecoverability.NON_RECOVERABLE;
        }
        return switch (error.getCategory()) {
            case CONNECTION, DISCOVERY, OPERATION -> ERecoverability.RECOVERABLE;
            case STATUS -> ERecoverability.POSSIBLY_RECOVERABLE;
            case PRINT -> error.is(ErrorCode.PRINT_TIMEOUT) || error.is(ErrorCode.PRINTER_PAUSED)
                    ? ERecoverability.RECOVERABLE
                    : ERecoverability.NON_RECOVERABLE;
            case DATA, PLATFORM -> ERecoverability.NON_RECOVERABLE;
            case SYSTEM -> classifyByMessage(error.getMessage());
        };
    }

    static ERecoverability classifyByMessage(String message) {
        if (message == null) {
            return ERecoverability.UNKNOWN;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("timeout") || lower.contains("timed out")
                || lower.contains("connection") || lower.contains("network")) {
            return ERecoverability.RECOVERABLE;
        }
        if (lower.contains("head") || lower.contains("paper")
                || lower.contains("ribbon") || lower.contains("hardware")) {
            return ERecoverability.NON_RECOVERABLE;
        }
        return ERecoverability.UNKNOWN;
    }

    public static PrintErrorInfo toPrintError(ErrorInfo error) {
        ERecoverability recoverability = classify(error);
        String hint = error.getRecoveryHint() != null ? error.getRecoveryHint() : defaultHint(recoverability);
        return new PrintErrorInfo(error.getMessage(), recoverability, error.getCode(), hint, error);
    }

    static String defaultHint(ERecoverability recoverability) {
        return switch (recoverability) {
            case RECOVERABLE -> "The problem is temporary. Try again.";
            case POSSIBLY_RECOVERABLE -> "Check the printer and try again.";
            case NON_RECOVERABLE -> "Resolve the problem before printing again.";
            case UNKNOWN -> "Try again or restart the printer.";
        };
    }
}
