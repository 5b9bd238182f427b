package eti.domain;

/**
 * Suspension point used for backoff, polling and dwell waits
 * @since 15/10/2026
 */
public interface ISleeper {
    /**
     * Sleep for the given time
     * @throws InterruptedException when the waiting thread is interrupted
     */
    void sleep(long millis) throws InterruptedException;

    ISleeper SYSTEM = millis -> {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    };
}
