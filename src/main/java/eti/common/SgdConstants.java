package eti.common;

/**
 * Set-Get-Do protocol constants
 * @since 14/10/2026
 */
public final class SgdConstants {
    private SgdConstants() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static final String LINE_TERMINATOR = "\r\n";

    // Setting keys
    public static final String KEY_MEDIA_STATUS = "media.status";
    public static final String KEY_HEAD_LATCH = "head.latch";
    public static final String KEY_DEVICE_PAUSE = "device.pause";
    public static final String KEY_HOST_STATUS = "device.host_status";
    public static final String KEY_LANGUAGES = "device.languages";

    // Fixed control commands
    public static final String CLEAR_ERRORS = "~JA";
    public static final String CALIBRATE = "~jc^xa^jus^xz";
    public static final byte CLEAR_BUFFER = 0x18;
    public static final byte FLUSH_BUFFER = 0x03;

    // Payload markers
    public static final String ZPL_START_MARKER = "^XA";
    public static final String CPCL_START_MARKER = "!";

    public static final int DEFAULT_PORT = 9100;
    public static final int DEFAULT_CONNECTION_TIMEOUT = 5000;
    public static final int DEFAULT_READ_TIMEOUT = 3000;
    public static final int DEFAULT_COMMAND_TIMEOUT = 7000;
    public static final int MAX_DATA_SIZE = 1_000_000;
}
