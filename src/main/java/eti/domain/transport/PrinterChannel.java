package eti.domain.transport;

import eti.domain.Result;
import eti.domain.policy.TimeoutPolicy;
import eti.domain.protocol.SgdCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Protocol-level access to a printer. Every transport call is bounded by the command timeout.
 * @since 15/10/2026
 */
public class PrinterChannel {
    private static final Logger logger = LoggerFactory.getLogger(PrinterChannel.class);

    private final IPrinterTransport transport;
    private final TimeoutPolicy timeoutPolicy;
    private final long commandTimeoutMs;

    public PrinterChannel(IPrinterTransport transport, TimeoutPolicy timeoutPolicy, long commandTimeoutMs) {
        this.transport = transport;
        this.timeoutPolicy = timeoutPolicy;
        this.commandTimeoutMs = commandTimeoutMs;
    }

    public Result<Void> connect(String address) {
        return timeoutPolicy.executeWithResult(() -> transport.connect(address), commandTimeoutMs);
    }

    public Result<Void> disconnect() {
        return timeoutPolicy.executeWithResult(transport::disconnect, commandTimeoutMs);
    }

    public Result<Boolean> isConnected() {
        return timeoutPolicy.executeWithResult(transport::isConnected, commandTimeoutMs);
    }

    /**
     * Read a setting value. A response that carries no value yields a successful {@code null}.
     */
    public Result<String> getSetting(String key) {
        Result<String> raw = timeoutPolicy.executeWithResult(() -> transport.query(key), commandTimeoutMs);
        if (raw.isFailure()) {
            return raw;
        }
        return Result.success(SgdCodec.parseResponse(raw.getData()));
    }

    public Result<Void> setSetting(String key, String value) {
        logger.debug("setvar {} = {}", key, value);
        return sendCommand(SgdCodec.set(key, value));
    }

    public Result<Void> doAction(String action, String value) {
        logger.debug("do {} {}", action, value);
        return sendCommand(SgdCodec.doAction(action, value));
    }

    public Result<Void> sendCommand(String command) {
        return sendBytes(SgdCodec.toBytes(command));
    }

    public Result<Void> sendBytes(byte[] data) {
        return timeoutPolicy.executeWithResult(() -> transport.sendRaw(data), commandTimeoutMs);
    }

    public IPrinterTransport getTransport() {
        return transport;
    }
}
