package eti.domain.protocol;

import eti.common.EPrintLanguage;
import eti.common.SgdConstants;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds and parses Set-Get-Do protocol messages.
 * All methods are total: malformed input yields {@code null}, never an exception.
 *
 * @since 14/10/2026
 */
public final class SgdCodec {
    private SgdCodec() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    private static final Pattern KEY_VALUE_RESPONSE = Pattern.compile("\"[^\"]*\"\\s*:\\s*\"([^\"]*)\"");

    public static String get(String key) {
        return "! U1 getvar \"" + key + "\"" + SgdConstants.LINE_TERMINATOR;
    }

    public static String set(String key, String value) {
        return "! U1 setvar \"" + key + "\" \"" + value + "\"" + SgdConstants.LINE_TERMINATOR;
    }

    public static String doAction(String action, String value) {
        return "! U1 do \"" + action + "\" \"" + value + "\"" + SgdConstants.LINE_TERMINATOR;
    }

    public static byte[] toBytes(String command) {
        return command.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Extract the value from a response. Handles both {@code "value"} and {@code "key" : "value"}.
     * @return the value, or {@code null} when the response carries nothing
     */
    public static String parseResponse(String response) {
        if (response == null) {
            return null;
        }
        String trimmed = response.trim();
        if (trimmed.isEmpty()) {
            return null;
        }

        Matcher matcher = KEY_VALUE_RESPONSE.matcher(trimmed);
        if (matcher.find()) {
            String value = matcher.group(1).trim();
            return value.isEmpty() ? null : value;
        }

        String value = stripQuotes(trimmed).trim();
        return value.isEmpty() ? null : value;
    }

    /**
     * Detect the language of a print payload from its markers
     */
    public static EPrintLanguage detectLanguage(String data) {
        if (data == null) {
            return EPrintLanguage.UNDETERMINED;
        }
        String trimmed = data.trim();
        if (trimmed.isEmpty()) {
            return EPrintLanguage.UNDETERMINED;
        }
        if (trimmed.toUpperCase().contains(SgdConstants.ZPL_START_MARKER)) {
            return EPrintLanguage.ZPL;
        }
        if (trimmed.startsWith(SgdConstants.CPCL_START_MARKER)) {
            return EPrintLanguage.CPCL;
        }
        return EPrintLanguage.UNDETERMINED;
    }

    private static String stripQuotes(String text) {
        String result = text;
        if (result.startsWith("\"")) {
            result = result.substring(1);
        }
        if (result.endsWith("\"")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
