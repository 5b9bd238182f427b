package eti.domain.readiness;

/**
 * @since 15/10/2026
 */
public enum EDimensionStatus {
    UNCHECKED,  // Not queried yet, or reset
    GOOD,       // Checked and healthy
    BAD         // Checked and faulty, or the query failed
}
