package eti.dal;

import eti.common.EConnectionType;
import eti.common.SgdConstants;

/**
 * Type-safe configuration for the target printer
 * @since 14/10/2026
 */
public record PrinterConfig(
        String name,
        String ipAddress,
        int networkPort,
        int connectionTimeout,
        int readTimeout,
        EConnectionType connectionType) {

    /**
     * Factory method: Create network printer configuration
     */
    public static PrinterConfig network(String name, String ipAddress, int networkPort,
                                        int connectionTimeout, int readTimeout) {
        return new PrinterConfig(name, ipAddress, networkPort, connectionTimeout, readTimeout, EConnectionType.NETWORK);
    }

    /**
     * Factory method: Create dummy printer configuration
     */
    public static PrinterConfig dummy(String name) {
        return new PrinterConfig(name, "dummy", SgdConstants.DEFAULT_PORT,
                SgdConstants.DEFAULT_CONNECTION_TIMEOUT, SgdConstants.DEFAULT_READ_TIMEOUT, EConnectionType.NONE);
    }

    /**
     * Transport address in {@code host:port} form
     */
    public String getAddress() {
        return ipAddress + ":" + networkPort;
    }

    public boolean isDummy() {
        return connectionType == EConnectionType.NONE;
    }

    @Override
    public String toString() {
        return switch (connectionType) {
            case NETWORK -> String.format("PrinterConfiguration{type=NETWORK, name='%s', ip='%s', port=%d, timeout=%d, readTimeout=%d}",
                    name, ipAddress, networkPort, connectionTimeout, readTimeout);
            case NONE -> String.format("PrinterConfiguration{type=NONE (Dummy), name='%s'}", name);
        };
    }

    /**
     * Validate configuration based on connection type
     */
    public void validate() throws ConfigurationException {
        if (name == null || name.trim().isEmpty()) {
            throw new ConfigurationException("Printer name cannot be empty");
        }
        if (connectionType == null) {
            throw new ConfigurationException("Connection type cannot be null");
        }
        if (connectionType == EConnectionType.NETWORK) {
            if (ipAddress == null || ipAddress.trim().isEmpty()) {
                throw new ConfigurationException("Printer IP address cannot be empty for NETWORK connection");
            }
            if (networkPort < 1 || networkPort > 65535) {
                throw new ConfigurationException("Network port must be between 1 and 65535");
            }
            if (connectionTimeout < 1000) {
                throw new ConfigurationException("Connection timeout must be at least 1000ms");
            }
            if (readTimeout < 100) {
                throw new ConfigurationException("Read timeout must be at least 100ms");
            }
        }
    }
}
