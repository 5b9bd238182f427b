package eti.domain.readiness;

import eti.common.SgdConstants;

/**
 * Independently checked aspects of printer health
 * @since 15/10/2026
 */
public enum EReadinessDimension {
    CONNECTION(null, "Not Connected"),
    MEDIA(SgdConstants.KEY_MEDIA_STATUS, "Out of Paper"),
    HEAD(SgdConstants.KEY_HEAD_LATCH, "Head Open"),
    PAUSE(SgdConstants.KEY_DEVICE_PAUSE, "Printer Paused"),
    HOST_ERRORS(SgdConstants.KEY_HOST_STATUS, "Printer Error"),
    LANGUAGE(SgdConstants.KEY_LANGUAGES, "Unknown Language");

    private final String settingKey;
    private final String issueName;

    EReadinessDimension(String settingKey, String issueName) {
        this.settingKey = settingKey;
        this.issueName = issueName;
    }

    /**
     * Setting queried for this dimension; {@code null} for the connection check
     */
    public String getSettingKey() {
        return settingKey;
    }

    public String getIssueName() {
        return issueName;
    }
}
