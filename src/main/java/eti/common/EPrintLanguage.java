package eti.common;

/**
 * Payload languages understood by the printer
 * @since 14/10/2026
 */
public enum EPrintLanguage {
    ZPL("zpl"),
    CPCL("line_print"),
    UNDETERMINED(null);

    private final String deviceValue;

    EPrintLanguage(String deviceValue) {
        this.deviceValue = deviceValue;
    }

    /**
     * Value written to {@code device.languages} to switch the printer into this language
     */
    public String getDeviceValue() {
        return deviceValue;
    }

    /**
     * Check whether a {@code device.languages} response reports this language as active
     */
    public boolean matches(String reportedLanguage) {
        if (reportedLanguage == null || this == UNDETERMINED) {
            return false;
        }
        String reported = reportedLanguage.toLowerCase();
        return switch (this) {
            case ZPL -> reported.contains("zpl");
            case CPCL -> reported.contains("line_print") || reported.contains("cpcl");
            case UNDETERMINED -> false;
        };
    }
}
