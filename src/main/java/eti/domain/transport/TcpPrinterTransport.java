package eti.domain.transport;

import eti.common.SgdConstants;
import eti.dal.PrinterConfig;
import eti.domain.ErrorCode;
import eti.domain.Result;
import eti.domain.protocol.SgdCodec;
import eti.domain.transport.TransportErrorBridge.EOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Raw TCP transport to a printer port.
 * Address format is {@code host[:port]}; the port defaults to 9100.
 *
 * @since 14/10/2026
 */
public class TcpPrinterTransport implements IPrinterTransport {
    private static final Logger logger = LoggerFactory.getLogger(TcpPrinterTransport.class);

    private final int connectTimeout;
    private final int readTimeout;
    private final ReentrantLock transportLock = new ReentrantLock();

    private Socket socket;
    private OutputStream outputStream;
    private InputStream inputStream;
    private volatile ETransportState state = ETransportState.CLOSED;

    @Inject
    public TcpPrinterTransport(PrinterConfig config) {
        this(config.connectionTimeout(), config.readTimeout());
    }

    public TcpPrinterTransport(int connectTimeout, int readTimeout) {
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
    }

    @Override
    public Result<Void> connect(String address) {
        InetSocketAddress target = parseAddress(address);
        if (target == null) {
            return Result.failure(ErrorCode.INVALID_DEVICE_ADDRESS, address);
        }

        transportLock.lock();
        try {
            closeQuietly();
            transitionTo(ETransportState.CONNECTING);
            logger.info("Connecting to printer at {}:{}", target.getHostString(), target.getPort());

            InetSocketAddress resolved = new InetSocketAddress(target.getHostString(), target.getPort());
            if (resolved.isUnresolved()) {
                transitionTo(ETransportState.FAILED);
                return Result.failure(ErrorCode.INVALID_DEVICE_ADDRESS, address);
            }

            Socket newSocket = new Socket();
            try {
                newSocket.connect(resolved, connectTimeout);
                newSocket.setKeepAlive(true);
                newSocket.setSoTimeout(readTimeout);
                socket = newSocket;
                outputStream = newSocket.getOutputStream();
                inputStream = newSocket.getInputStream();
            } catch (IOException e) {
                logger.warn("Connection to {} failed: {}", address, e.getMessage());
                closeSocket(newSocket);
                transitionTo(ETransportState.FAILED);
                return TransportErrorBridge.wrap(EOperation.CONNECT, e, connectTimeout);
            }

            transitionTo(ETransportState.CONNECTED);
            return Result.success();
        } finally {
            transportLock.unlock();
        }
    }

    @Override
    public Result<Void> disconnect() {
        transportLock.lock();
        try {
            if (socket == null) {
                return Result.success();
            }
            try {
                socket.close();
            } catch (IOException e) {
                logger.warn("Error closing printer socket: {}", e.getMessage());
                return TransportErrorBridge.wrap(EOperation.DISCONNECT, e, connectTimeout);
            } finally {
                socket = null;
                outputStream = null;
                inputStream = null;
                transitionTo(ETransportState.CLOSED);
            }
            return Result.success();
        } finally {
            transportLock.unlock();
        }
    }

    @Override
    public Result<Boolean> isConnected() {
        Socket current = socket;
        return Result.success(state == ETransportState.CONNECTED
                && current != null && current.isConnected() && !current.isClosed());
    }

    @Override
    public Result<String> query(String key) {
        transportLock.lock();
        try {
            if (state != ETransportState.CONNECTED) {
                return Result.failure(ErrorCode.NOT_CONNECTED);
            }
            try {
                drainInput();
                outputStream.write(SgdCodec.toBytes(SgdCodec.get(key)));
                outputStream.flush();
                String response = readResponse();
                logger.debug("Query '{}' -> '{}'", key, response);
                return Result.success(response);
            } catch (IOException e) {
                logger.warn("Query '{}' failed: {}", key, e.getMessage());
                markFailedIfClosed();
                return TransportErrorBridge.wrap(EOperation.QUERY, e, readTimeout);
            }
        } finally {
            transportLock.unlock();
        }
    }

    @Override
    public Result<Void> sendRaw(byte[] data) {
        transportLock.lock();
        try {
            if (state != ETransportState.CONNECTED) {
                return Result.failure(ErrorCode.NOT_CONNECTED);
            }
            try {
                outputStream.write(data);
                outputStream.flush();
                logger.debug("Sent {} bytes", data.length);
                return Result.success();
            } catch (IOException e) {
                logger.warn("Send of {} bytes failed: {}", data.length, e.getMessage());
                markFailedIfClosed();
                return TransportErrorBridge.wrap(EOperation.SEND, e, readTimeout);
            }
        } finally {
            transportLock.unlock();
        }
    }

    public ETransportState getState() {
        return state;
    }

    /**
     * Read until a balanced quoted value has arrived and the line is quiet, or the read times out
     */
    private String readResponse() throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] chunk = new byte[512];
        int quotes = 0;

        while (true) {
            int read;
            try {
                read = inputStream.read(chunk);
            } catch (SocketTimeoutException e) {
                if (buffer.size() > 0) {
                    break;
                }
                throw e;
            }
            if (read < 0) {
                if (buffer.size() > 0) {
                    break;
                }
                throw new IOException("Connection closed by printer");
            }
            buffer.write(chunk, 0, read);
            for (int i = 0; i < read; i++) {
                if (chunk[i] == '"') {
                    quotes++;
                }
            }
            if (quotes >= 2 && quotes % 2 == 0 && inputStream.available() == 0) {
                break;
            }
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }

    // Discard stale bytes from an earlier timed out response
    private void drainInput() throws IOException {
        int available = inputStream.available();
        if (available > 0) {
            long skipped = inputStream.skip(available);
            logger.debug("Discarded {} stale bytes", skipped);
        }
    }

    private void markFailedIfClosed() {
        if (socket == null || socket.isClosed() || !socket.isConnected()) {
            transitionTo(ETransportState.FAILED);
        }
    }

    private void closeQuietly() {
        if (socket != null) {
            closeSocket(socket);
            socket = null;
            outputStream = null;
            inputStream = null;
        }
    }

    private void closeSocket(Socket toClose) {
        try {
            toClose.close();
        } catch (IOException e) {
            logger.debug("Ignoring error while closing socket: {}", e.getMessage());
        }
    }

    private void transitionTo(ETransportState newState) {
        ETransportState oldState = state;
        state = newState;
        if (oldState != newState) {
            logger.debug("Transport state: {} -> {}", oldState, newState);
        }
    }

    static InetSocketAddress parseAddress(String address) {
        if (address == null || address.isBlank()) {
            return null;
        }
        String host = address.trim();
        int port = SgdConstants.DEFAULT_PORT;
        int separator = host.lastIndexOf(':');
        if (separator > 0 && host.indexOf(':') == separator) {
            try {
                port = Integer.parseInt(host.substring(separator + 1));
            } catch (NumberFormatException e) {
                return null;
            }
            host = host.substring(0, separator);
        }
        if (port < 1 || port > 65535) {
            return null;
        }
        return InetSocketAddress.createUnresolved(host, port);
    }
}
