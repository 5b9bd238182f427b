package eti.domain.transport;

import eti.domain.Result;

/**
 * Byte transport to a single printer. Implementations never throw; every failure is a failed {@link Result}.
 * @since 14/10/2026
 */
public interface IPrinterTransport {
    Result<Void> connect(String address);

    Result<Void> disconnect();

    Result<Boolean> isConnected();

    /**
     * Send a getvar request for the key and return the raw response text
     */
    Result<String> query(String key);

    Result<Void> sendRaw(byte[] data);
}
