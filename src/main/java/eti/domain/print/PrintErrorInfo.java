package eti.domain.print;

import eti.domain.ErrorInfo;

/**
 * A workflow error with its recoverability classification
 * @since 16/10/2026
 */
public record PrintErrorInfo(
        String message,
        ERecoverability recoverability,
        String errorCode,
        String recoveryHint,
        ErrorInfo error) {
}
