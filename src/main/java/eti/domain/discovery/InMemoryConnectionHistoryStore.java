package eti.domain.discovery;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-lifetime history store
 * @since 16/10/2026
 */
public class InMemoryConnectionHistoryStore implements IConnectionHistoryStore {
    private final Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();

    @Override
    public int getSuccessCount(String address) {
        AtomicInteger count = counts.get(address);
        return count != null ? count.get() : 0;
    }

    @Override
    public int incrementSuccessCount(String address) {
        return counts.computeIfAbsent(address, key -> new AtomicInteger()).incrementAndGet();
    }
}
