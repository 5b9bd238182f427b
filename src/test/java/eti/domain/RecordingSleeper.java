package eti.domain;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sleeper that records requested delays and returns immediately
 */
public class RecordingSleeper implements ISleeper {
    private final List<Long> delays = new CopyOnWriteArrayList<>();
    private volatile Runnable onSleep = () -> { };

    @Override
    public void sleep(long millis) {
        delays.add(millis);
        onSleep.run();
    }

    /**
     * Run an action every time sleep is called
     */
    public void onSleep(Runnable action) {
        this.onSleep = action;
    }

    public List<Long> getDelays() {
        return delays;
    }

    public long getTotalDelay() {
        return delays.stream().mapToLong(Long::longValue).sum();
    }
}
