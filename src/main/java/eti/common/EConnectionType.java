package eti.common;

/**
 * @since 14/10/2026
 */
public enum EConnectionType {
    NETWORK,  // Raw TCP connection
    NONE      // Dummy mode (simulated printer)
}
