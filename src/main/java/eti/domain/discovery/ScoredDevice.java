package eti.domain.discovery;

/**
 * @since 16/10/2026
 */
public record ScoredDevice(PrinterDevice device, int score) {
}
