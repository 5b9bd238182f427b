package eti.common;

/**
 * Transport over which a discovered printer is reachable
 * @since 14/10/2026
 */
public enum ETransportType {
    NETWORK,    // Wi-Fi / Ethernet
    BLUETOOTH   // Radio link
}
