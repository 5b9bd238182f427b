package eti.domain.readiness;

import com.google.common.collect.ImmutableList;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A readiness snapshot together with the corrections applied to it
 * @since 15/10/2026
 */
public final class CorrectedReadiness {
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormat.forPattern("dd.MM.yyyy HH:mm:ss.SSS");

    private final PrinterReadiness readiness;
    private final List<CorrectionEntry> corrections;
    private final long timestamp;

    public CorrectedReadiness(PrinterReadiness readiness, List<CorrectionEntry> corrections, long timestamp) {
        this.readiness = readiness;
        this.corrections = ImmutableList.copyOf(corrections);
        this.timestamp = timestamp;
    }

    public PrinterReadiness getReadiness() {
        return readiness;
    }

    /**
     * Corrections in the order they were attempted
     */
    public List<CorrectionEntry> getCorrections() {
        return corrections;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public boolean hasCorrections() {
        return !corrections.isEmpty();
    }

    public boolean allCorrectionsSuccessful() {
        return corrections.stream().allMatch(CorrectionEntry::success);
    }

    public boolean hasFailedCorrections() {
        return corrections.stream().anyMatch(entry -> !entry.success());
    }

    /**
     * At least one correction was attempted and succeeded
     */
    public boolean isCorrected() {
        return corrections.stream().anyMatch(CorrectionEntry::success);
    }

    public List<String> getAppliedCorrections() {
        return corrections.stream().filter(CorrectionEntry::success).map(CorrectionEntry::name)
                .collect(ImmutableList.toImmutableList());
    }

    public List<String> getCorrectionErrors() {
        return corrections.stream().filter(entry -> !entry.success())
                .map(entry -> entry.name() + ": " + entry.error())
                .collect(ImmutableList.toImmutableList());
    }

    public String correctionSummary() {
        if (corrections.isEmpty()) {
            return "No corrections applied";
        }
        String fixed = corrections.stream().filter(CorrectionEntry::success)
                .map(CorrectionEntry::name).collect(Collectors.joining(", "));
        String failed = corrections.stream().filter(entry -> !entry.success())
                .map(CorrectionEntry::name).collect(Collectors.joining(", "));

        StringBuilder summary = new StringBuilder();
        if (!fixed.isEmpty()) {
            summary.append("Fixed: ").append(fixed);
        }
        if (!failed.isEmpty()) {
            if (summary.length() > 0) {
                summary.append("; ");
            }
            summary.append("Failed: ").append(failed);
        }
        return summary.toString();
    }

    public String detailedInfo() {
        StringBuilder info = new StringBuilder();
        info.append("Readiness at ").append(TIMESTAMP_FORMAT.print(timestamp)).append('\n');
        info.append("  Ready: ").append(readiness.isReady()).append('\n');
        for (EReadinessDimension dimension : EReadinessDimension.values()) {
            if (readiness.getOptions().isChecked(dimension)) {
                info.append("  ").append(dimension).append(": ").append(readiness.getState(dimension)).append('\n');
            }
        }
        readiness.getErrors().forEach(error -> info.append("  Error: ").append(error).append('\n'));
        readiness.getWarnings().forEach(warning -> info.append("  Warning: ").append(warning).append('\n'));
        for (CorrectionEntry entry : corrections) {
            info.append("  Correction ").append(entry.name()).append(": ")
                    .append(entry.success() ? "OK" : "FAILED (" + entry.error() + ")").append('\n');
        }
        info.append("  Summary: ").append(correctionSummary());
        return info.toString();
    }

    @Override
    public String toString() {
        return "CorrectedReadiness{" + correctionSummary() + ", ready=" + readiness.isReady() + "}";
    }
}
