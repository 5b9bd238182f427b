package eti.domain.protocol;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes printer health responses, free text or comma separated fields.
 * Vocabulary and code tables are a minimum set; unknown entries never fail parsing.
 *
 * @since 14/10/2026
 */
public final class StatusParser {
    private StatusParser() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    private static final Pattern NUMBER = Pattern.compile("(-?\\d+\\.?\\d*)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Set<String> TRUE_VALUES =
            ImmutableSet.of("true", "on", "1", "yes", "y", "enabled", "active");
    private static final Set<String> FALSE_VALUES =
            ImmutableSet.of("false", "off", "0", "no", "n", "disabled", "inactive");

    private static final Set<String> HEALTHY_WORDS = ImmutableSet.of("ok", "ready", "normal", "idle");

    // Checked in order; first match wins
    private static final Map<String, String> FAULT_WORDS = ImmutableMap.<String, String>builder()
            .put("paper out", "Out of paper")
            .put("media out", "Out of paper")
            .put("ribbon out", "Out of ribbon")
            .put("head open", "Print head open")
            .put("head cold", "Print head cold")
            .put("head over temp", "Print head overheated")
            .put("head too hot", "Print head overheated")
            .put("pause", "Printer paused")
            .build();

    private static final Map<Integer, String> ERROR_CODES = ImmutableMap.<Integer, String>builder()
            .put(1, "Printer is paused")
            .put(2, "Printer is processing")
            .put(3, "Printer is receiving data")
            .put(4, "Printer is warming up")
            .put(5, "Printer is cooling down")
            .put(6, "Printer is calibrating")
            .put(7, "Printer is initializing")
            .put(8, "Printer is shutting down")
            .put(9, "Printer is rebooting")
            .put(10, "Printer is updating firmware")
            .put(100, "Out of paper/media")
            .put(101, "Out of ribbon")
            .put(102, "Print head is open")
            .put(103, "Print head is cold")
            .put(104, "Print head is too hot")
            .put(105, "Print head is dirty")
            .put(106, "Print head is damaged")
            .put(107, "Print head is misaligned")
            .put(108, "Print head is not installed")
            .put(150, "Media sensor error")
            .put(151, "Ribbon sensor error")
            .put(152, "Print head sensor error")
            .put(153, "Platen sensor error")
            .put(154, "Temperature sensor error")
            .put(155, "Pressure sensor error")
            .put(156, "Position sensor error")
            .put(157, "Speed sensor error")
            .put(158, "Tension sensor error")
            .put(159, "Hardware error detected")
            .put(160, "Firmware error")
            .put(161, "Software error")
            .put(162, "Configuration error")
            .put(163, "Communication error")
            .put(164, "Network error")
            .put(165, "Protocol error")
            .put(166, "Format error")
            .put(167, "Data error")
            .put(168, "Memory error")
            .put(169, "Buffer error")
            .put(200, "Media type mismatch")
            .put(201, "Ribbon type mismatch")
            .put(202, "Print head type mismatch")
            .put(203, "Platen type mismatch")
            .put(204, "Sensor type mismatch")
            .put(205, "Firmware version mismatch")
            .put(206, "Software version mismatch")
            .put(207, "Hardware version mismatch")
            .put(208, "Configuration mismatch")
            .put(209, "Protocol version mismatch")
            .put(210, "Format version mismatch")
            .put(211, "Data format mismatch")
            .put(212, "Encoding mismatch")
            .put(213, "Character set mismatch")
            .put(214, "Language mismatch")
            .build();

    /**
     * Parse a host status response in either shape
     */
    public static HostStatusInfo parseHostStatus(String response) {
        String status = normalize(response);
        if (status == null) {
            return new HostStatusInfo(false, null, "No status response", null);
        }
        if (status.contains(",")) {
            return parseFieldEncoded(status);
        }
        return parseFreeText(status);
    }

    private static HostStatusInfo parseFieldEncoded(String status) {
        String[] parts = status.split(",");
        Map<Integer, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < parts.length; i++) {
            fields.put(i, parts[i].trim());
        }

        Integer code = toInt(parts[0]);
        if (code == null) {
            return new HostStatusInfo(false, null, "Invalid status code: " + parts[0].trim(), fields);
        }
        if (code == 0) {
            return new HostStatusInfo(true, 0, null, fields);
        }
        return new HostStatusInfo(false, code, errorMessageFor(code), fields);
    }

    private static HostStatusInfo parseFreeText(String status) {
        String lower = status.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> fault : FAULT_WORDS.entrySet()) {
            if (lower.contains(fault.getKey())) {
                return new HostStatusInfo(false, null, fault.getValue(), null);
            }
        }
        if (isHealthyText(lower)) {
            return new HostStatusInfo(true, null, null, null);
        }
        if (lower.contains("error")) {
            return new HostStatusInfo(false, null, status, null);
        }
        return new HostStatusInfo(false, null, "Unknown status: " + status, null);
    }

    /**
     * Canonical message for a primary status code
     */
    public static String errorMessageFor(int code) {
        String message = ERROR_CODES.get(code);
        return message != null ? message : "Unknown error code: " + code;
    }

    /**
     * Coerce a boolean spelling.
     * @return {@code null} when the value is not a recognised spelling
     */
    public static Boolean toBool(String value) {
        String normalized = normalize(value);
        if (normalized == null) {
            return null;
        }
        String lower = normalized.toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(lower)) {
            return Boolean.TRUE;
        }
        if (FALSE_VALUES.contains(lower)) {
            return Boolean.FALSE;
        }
        return null;
    }

    public static Integer toInt(String value) {
        String normalized = normalize(value);
        if (normalized == null) {
            return null;
        }
        try {
            return Integer.parseInt(normalized);
        } catch (NumberFormatException e) {
            Double number = extractNumber(normalized);
            return number != null ? number.intValue() : null;
        }
    }

    /**
     * First signed integer or decimal found in the text
     */
    public static Double extractNumber(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = NUMBER.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Double.parseDouble(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Media presence from {@code media.status}. {@code null} when unrecognised.
     */
    public static Boolean parseMediaPresent(String value) {
        String normalized = normalize(value);
        if (normalized == null) {
            return null;
        }
        String lower = normalized.toLowerCase(Locale.ROOT);
        if (containsAny(lower, "out", "empty", "missing", "absent")) {
            return Boolean.FALSE;
        }
        if (containsAny(lower, "ok", "ready", "loaded", "present")) {
            return Boolean.TRUE;
        }
        return null;
    }

    /**
     * Head closed state from {@code head.latch}. {@code null} when unrecognised.
     */
    public static Boolean parseHeadClosed(String value) {
        String normalized = normalize(value);
        if (normalized == null) {
            return null;
        }
        String lower = normalized.toLowerCase(Locale.ROOT);
        if (containsAny(lower, "open", "unlocked")) {
            return Boolean.FALSE;
        }
        if (containsAny(lower, "closed", "ok", "locked")) {
            return Boolean.TRUE;
        }
        return null;
    }

    public static boolean isHealthyText(String value) {
        String normalized = normalize(value);
        if (normalized == null) {
            return false;
        }
        String lower = normalized.toLowerCase(Locale.ROOT);
        return HEALTHY_WORDS.stream().anyMatch(lower::contains);
    }

    /**
     * Strip quotes and collapse whitespace; {@code null} for blank input
     */
    public static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String result = WHITESPACE.matcher(value.replace("\"", "")).replaceAll(" ").trim();
        return result.isEmpty() ? null : result;
    }

    private static boolean containsAny(String text, String... words) {
        for (String word : words) {
            if (text.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
