package eti.domain.discovery;

import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Map;

/**
 * Tunable scoring weights for device selection.
 * Model priorities are matched by substring in declaration order; the first hit wins.
 *
 * @since 16/10/2026
 */
public record SelectorWeights(
        int previousSelectionBonus,
        int preferredTransportScore,
        int otherTransportScore,
        Map<String, Integer> modelPriorities,
        int unknownModelScore,
        int connectedScore,
        int readyScore,
        int discoveredScore,
        int otherStatusScore) {

    public static SelectorWeights defaults() {
        return new SelectorWeights(
                1000,
                30,
                20,
                ImmutableMap.<String, Integer>builder()
                        .put("RW420", 25)
                        .put("ZQ521", 23)
                        .put("ZQ520", 22)
                        .put("ZQ510", 20)
                        .put("ZQ", 15)
                        .put("ZEBRA", 10)
                        .build(),
                5,
                10,
                8,
                5,
                3);
    }

    public int modelScore(String name) {
        if (name == null) {
            return unknownModelScore;
        }
        String upper = name.toUpperCase(Locale.ROOT);
        for (Map.Entry<String, Integer> entry : modelPriorities.entrySet()) {
            if (upper.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return unknownModelScore;
    }

    /**
     * Diminishing returns on prior successful connections
     */
    public int historyScore(int successCount) {
        if (successCount >= 5) {
            return 15;
        }
        if (successCount >= 3) {
            return 10;
        }
        if (successCount >= 1) {
            return 5;
        }
        return 0;
    }

    public int availabilityScore(PrinterDevice device) {
        if (device.connected()) {
            return connectedScore;
        }
        String status = device.status() != null ? device.status().toLowerCase(Locale.ROOT) : "";
        if (status.contains("ready")) {
            return readyScore;
        }
        if (status.contains("found") || status.contains("discovered")) {
            return discoveredScore;
        }
        return otherStatusScore;
    }
}
