package eti.domain.transport;

import com.google.common.collect.ImmutableList;
import eti.common.SgdConstants;
import eti.domain.ErrorCode;
import eti.domain.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dummy transport - simulates a healthy printer when no hardware is available.
 * Answers getvar from an in-memory settings map and applies setvar commands it receives.
 *
 * @since 15/10/2026
 */
public class DummyPrinterTransport implements IPrinterTransport {
    private static final Logger logger = LoggerFactory.getLogger(DummyPrinterTransport.class);

    private static final Pattern SETVAR = Pattern.compile("!\\s*U1\\s+setvar\\s+\"([^\"]*)\"\\s+\"([^\"]*)\"");

    private final Map<String, String> settings = new ConcurrentHashMap<>();
    private final List<byte[]> received = new CopyOnWriteArrayList<>();
    private final AtomicInteger queryCount = new AtomicInteger();
    private volatile boolean connected = false;
    private volatile String connectedAddress;

    public DummyPrinterTransport() {
        settings.put(SgdConstants.KEY_MEDIA_STATUS, "ok");
        settings.put(SgdConstants.KEY_HEAD_LATCH, "ok");
        settings.put(SgdConstants.KEY_DEVICE_PAUSE, "0");
        settings.put(SgdConstants.KEY_HOST_STATUS, "0,0,0,0,0,0,0,0,0,0,0,0");
        settings.put(SgdConstants.KEY_LANGUAGES, "zpl");
    }

    @Override
    public Result<Void> connect(String address) {
        connected = true;
        connectedAddress = address;
        logger.info("DummyPrinterTransport connected to {} (no physical hardware)", address);
        return Result.success();
    }

    @Override
    public Result<Void> disconnect() {
        connected = false;
        logger.info("DummyPrinterTransport disconnected");
        return Result.success();
    }

    @Override
    public Result<Boolean> isConnected() {
        return Result.success(connected);
    }

    @Override
    public Result<String> query(String key) {
        if (!connected) {
            return Result.failure(ErrorCode.NOT_CONNECTED);
        }
        queryCount.incrementAndGet();
        String value = settings.get(key);
        logger.debug("DummyPrinterTransport.query: {} -> {}", key, value);
        return Result.success(value != null ? "\"" + value + "\"" : "\"?\"");
    }

    @Override
    public Result<Void> sendRaw(byte[] data) {
        if (!connected) {
            return Result.failure(ErrorCode.NOT_CONNECTED);
        }
        received.add(data.clone());
        String text = new String(data, StandardCharsets.UTF_8);
        Matcher matcher = SETVAR.matcher(text);
        while (matcher.find()) {
            settings.put(matcher.group(1), matcher.group(2));
            logger.debug("DummyPrinterTransport.setvar: {} = {}", matcher.group(1), matcher.group(2));
        }
        logger.debug("DummyPrinterTransport.sendRaw: {} bytes", data.length);
        return Result.success();
    }

    public void setSetting(String key, String value) {
        settings.put(key, value);
    }

    public String getSetting(String key) {
        return settings.get(key);
    }

    public List<byte[]> getReceived() {
        return ImmutableList.copyOf(received);
    }

    public List<String> getReceivedText() {
        return received.stream()
                .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
                .collect(ImmutableList.toImmutableList());
    }

    public int getQueryCount() {
        return queryCount.get();
    }

    public String getConnectedAddress() {
        return connectedAddress;
    }
}
