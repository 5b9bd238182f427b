package eti.domain.correction;

import eti.domain.ISleeper;
import eti.domain.Result;
import eti.domain.protocol.StatusParser;
import eti.domain.transport.PrinterChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;

/**
 * Applies a setting change and polls until the printer reports it.
 * Skips the command entirely when the setting already has the desired value.
 *
 * @since 15/10/2026
 */
public class StateChangeVerifier {
    private static final Logger logger = LoggerFactory.getLogger(StateChangeVerifier.class);

    private final PrinterChannel channel;
    private final int maxAttempts;
    private final long checkDelayMs;
    private final ISleeper sleeper;

    public StateChangeVerifier(PrinterChannel channel, int maxAttempts, long checkDelayMs, ISleeper sleeper) {
        this.channel = channel;
        this.maxAttempts = maxAttempts;
        this.checkDelayMs = checkDelayMs;
        this.sleeper = sleeper;
    }

    /**
     * @return {@code true} once the printer reports the desired value, {@code false} if it never did
     */
    public Result<Boolean> setBooleanState(String key, boolean desired) {
        return setState(key, desired ? "true" : "false",
                value -> Boolean.valueOf(desired).equals(StatusParser.toBool(value)));
    }

    /**
     * @param accepted decides whether a read-back value counts as the desired state
     */
    public Result<Boolean> setStringState(String key, String desired, Predicate<String> accepted) {
        return setState(key, desired, accepted);
    }

    private Result<Boolean> setState(String key, String desired, Predicate<String> accepted) {
        Result<String> current = channel.getSetting(key);
        if (current.isSuccess() && current.getData() != null && accepted.test(current.getData())) {
            logger.debug("{} already '{}', no change needed", key, current.getData());
            return Result.success(true);
        }

        Result<Void> sent = channel.setSetting(key, desired);
        if (sent.isFailure()) {
            return sent.propagate();
        }

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                sleeper.sleep(checkDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Result.success(false);
            }
            Result<String> readBack = channel.getSetting(key);
            if (readBack.isSuccess() && readBack.getData() != null && accepted.test(readBack.getData())) {
                logger.info("{} changed to '{}' (verified on poll {})", key, readBack.getData(), attempt);
                return Result.success(true);
            }
            logger.debug("{} not yet '{}' on poll {}/{}", key, desired, attempt, maxAttempts);
        }

        logger.warn("{} did not change to '{}' after {} polls", key, desired, maxAttempts);
        return Result.success(false);
    }
}
