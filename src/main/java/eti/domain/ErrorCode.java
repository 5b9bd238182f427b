package eti.domain;

import java.text.MessageFormat;

/**
 * Stable machine codes with message templates and recovery hints
 * @since 14/10/2026
 */
public enum ErrorCode {
    // Connection
    CONNECTION_ERROR(EErrorCategory.CONNECTION, "Failed to connect to printer",
            "Check that the printer is powered on and within range"),
    CONNECTION_TIMEOUT(EErrorCategory.CONNECTION, "Connection timed out after {0} seconds",
            "Move closer to the printer or check the network and try again"),
    NOT_CONNECTED(EErrorCategory.CONNECTION, "Not connected to printer",
            "Connect to a printer first"),
    CONNECTION_LOST(EErrorCategory.CONNECTION, "Connection to printer was lost",
            "Reconnect to the printer"),
    CONNECTION_RETRY_FAILED(EErrorCategory.CONNECTION, "Failed to connect after {0} attempts",
            "Restart the printer and try again"),
    INVALID_DEVICE_ADDRESS(EErrorCategory.CONNECTION, "Invalid printer address: {0}",
            "Verify the printer address"),

    // Discovery
    DISCOVERY_ERROR(EErrorCategory.DISCOVERY, "Printer discovery failed",
            "Check that discovery is permitted and try again"),
    NO_PRINTERS_FOUND(EErrorCategory.DISCOVERY, "No printers found",
            "Make sure the printer is powered on and discoverable"),

    // Print
    PRINT_ERROR(EErrorCategory.PRINT, "Print operation failed",
            "Check the printer and try again"),
    PRINT_TIMEOUT(EErrorCategory.PRINT, "Print operation timed out",
            "Check the printer for a stalled job and try again"),
    PRINTER_NOT_READY(EErrorCategory.PRINT, "Printer is not ready: {0}",
            "Resolve the reported printer issue"),
    OUT_OF_PAPER(EErrorCategory.PRINT, "Printer is out of paper",
            "Load media into the printer"),
    HEAD_OPEN(EErrorCategory.PRINT, "Printer head is open",
            "Close the print head"),
    PRINTER_PAUSED(EErrorCategory.PRINT, "Printer is paused",
            "Press the pause button to resume the printer"),
    RIBBON_ERROR(EErrorCategory.PRINT, "Ribbon error detected",
            "Check or replace the ribbon"),
    PRINT_RETRY_FAILED(EErrorCategory.PRINT, "Print failed after {0} attempts",
            "Check the printer status and try again"),
    PRINT_DATA_INVALID_FORMAT(EErrorCategory.DATA, "Print data format could not be determined",
            "Send ZPL or CPCL formatted data"),
    PRINT_DATA_TOO_LARGE(EErrorCategory.DATA, "Print data too large: {0} bytes",
            "Split the job into smaller labels"),
    LANGUAGE_MISMATCH(EErrorCategory.PRINT, "Printer language mismatch: expected {0}, got {1}",
            "Switch the printer to the language of the print data"),

    // Data
    INVALID_DATA(EErrorCategory.DATA, "Invalid data: {0}",
            "Check the data being sent"),
    EMPTY_DATA(EErrorCategory.DATA, "No data provided for printing",
            "Provide label data to print"),

    // Operation
    OPERATION_TIMEOUT(EErrorCategory.OPERATION, "Operation timed out after {0} ms",
            "Try the operation again"),
    OPERATION_CANCELLED(EErrorCategory.OPERATION, "Operation was cancelled",
            "Start the operation again if needed"),
    OPERATION_ERROR(EErrorCategory.OPERATION, "Operation failed: {0}",
            "Try the operation again"),
    RETRY_LIMIT_EXCEEDED(EErrorCategory.OPERATION, "Retry limit exceeded after {0} attempts",
            "Wait a moment before trying again"),

    // Status
    STATUS_CHECK_FAILED(EErrorCategory.STATUS, "Failed to check printer status: {0}",
            "Check the printer connection"),
    STATUS_TIMEOUT(EErrorCategory.STATUS, "Printer status request timed out",
            "Check the printer connection"),
    INVALID_STATUS_RESPONSE(EErrorCategory.STATUS, "Invalid status response: {0}",
            "Restart the printer"),
    BLOCKING_ISSUES(EErrorCategory.STATUS, "Printer has blocking issues: {0}",
            "Resolve the printer issues and try again"),

    // Platform
    PLATFORM_ERROR(EErrorCategory.PLATFORM, "Platform error: {0}",
            "Restart the application"),

    // System
    UNKNOWN_ERROR(EErrorCategory.SYSTEM, "Unknown error: {0}",
            "Try again or restart the printer");

    private final EErrorCategory category;
    private final String template;
    private final String recoveryHint;

    ErrorCode(EErrorCategory category, String template, String recoveryHint) {
        this.category = category;
        this.template = template;
        this.recoveryHint = recoveryHint;
    }

    public EErrorCategory getCategory() {
        return category;
    }

    public String getTemplate() {
        return template;
    }

    public String getRecoveryHint() {
        return recoveryHint;
    }

    /**
     * Fill the template placeholders. Missing arguments leave the placeholder text in place.
     */
    public String format(Object... args) {
        if (args == null || args.length == 0) {
            return template;
        }
        String[] asText = new String[args.length];
        for (int i = 0; i < args.length; i++) {
            asText[i] = String.valueOf(args[i]);
        }
        return MessageFormat.format(template.replace("'", "''"), (Object[]) asText);
    }
}
