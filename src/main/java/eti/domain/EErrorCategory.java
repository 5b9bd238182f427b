package eti.domain;

/**
 * @since 14/10/2026
 */
public enum EErrorCategory {
    CONNECTION,
    DISCOVERY,
    PRINT,
    DATA,
    OPERATION,
    STATUS,
    PLATFORM,
    SYSTEM
}
