package eti.domain.discovery;

/**
 * Per-address count of successful connections
 * @since 16/10/2026
 */
public interface IConnectionHistoryStore {
    int getSuccessCount(String address);

    /**
     * @return the count after incrementing
     */
    int incrementSuccessCount(String address);
}
