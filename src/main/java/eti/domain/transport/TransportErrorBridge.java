package eti.domain.transport;

import eti.domain.ErrorCode;
import eti.domain.ErrorInfo;
import eti.domain.Result;

import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

/**
 * Converts transport exceptions into failed results. This is the only place
 * where exceptions become {@link ErrorInfo}; callers forward the result unchanged.
 *
 * @since 14/10/2026
 */
public final class TransportErrorBridge {
    private TransportErrorBridge() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public enum EOperation {
        CONNECT,
        DISCONNECT,
        QUERY,
        SEND
    }

    public static <T> Result<T> wrap(EOperation operation, Exception e, long timeoutMs) {
        return Result.failure(toErrorInfo(operation, e, timeoutMs));
    }

    public static ErrorInfo toErrorInfo(EOperation operation, Exception e, long timeoutMs) {
        if (e instanceof UnknownHostException) {
            return ErrorInfo.of(ErrorCode.INVALID_DEVICE_ADDRESS, e, e.getMessage());
        }
        if (e instanceof SocketTimeoutException) {
            return switch (operation) {
                case CONNECT -> ErrorInfo.of(ErrorCode.CONNECTION_TIMEOUT, e, timeoutMs / 1000);
                case QUERY -> ErrorInfo.of(ErrorCode.STATUS_TIMEOUT, e);
                case SEND -> ErrorInfo.of(ErrorCode.PRINT_TIMEOUT, e);
                case DISCONNECT -> ErrorInfo.of(ErrorCode.OPERATION_TIMEOUT, e, timeoutMs);
            };
        }
        if (e instanceof ConnectException || e instanceof NoRouteToHostException) {
            return ErrorInfo.of(ErrorCode.CONNECTION_ERROR, e);
        }
        if (e instanceof SocketException) {
            return ErrorInfo.of(ErrorCode.CONNECTION_LOST, e);
        }
        if (e instanceof IOException) {
            return switch (operation) {
                case CONNECT -> ErrorInfo.of(ErrorCode.CONNECTION_ERROR, e);
                case QUERY -> ErrorInfo.of(ErrorCode.STATUS_CHECK_FAILED, e, e.getMessage());
                case SEND -> ErrorInfo.of(ErrorCode.PRINT_ERROR, e);
                case DISCONNECT -> ErrorInfo.of(ErrorCode.OPERATION_ERROR, e, e.getMessage());
            };
        }
        return ErrorInfo.of(ErrorCode.UNKNOWN_ERROR, e, e.getMessage());
    }
}
