package eti.domain;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal, checked at step boundaries
 * @since 15/10/2026
 */
public class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void reset() {
        cancelled.set(false);
    }
}
