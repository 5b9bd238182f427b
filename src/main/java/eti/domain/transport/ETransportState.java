package eti.domain.transport;

/**
 * @since 14/10/2026
 */
public enum ETransportState {
    CLOSED,       // No connection
    CONNECTING,   // Socket being opened
    CONNECTED,    // Ready for traffic
    FAILED        // Last connection attempt or I/O failed
}
