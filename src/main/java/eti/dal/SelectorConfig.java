package eti.dal;

import eti.common.ETransportType;

/**
 * Device selection settings
 * @since 14/10/2026
 */
public record SelectorConfig(ETransportType preferredTransport, String historyFile) {

    /**
     * History is persisted only when a file is configured
     */
    public boolean isHistoryPersistent() {
        return historyFile != null && !historyFile.isBlank();
    }

    public void validate() throws ConfigurationException {
        if (preferredTransport == null) {
            throw new ConfigurationException("Preferred transport cannot be null");
        }
    }
}
