package eti.domain.discovery;

import com.google.common.collect.ImmutableList;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Selection outcome with the ranked candidate list
 * @since 16/10/2026
 */
public record SmartDiscoveryResult(
        PrinterDevice selectedPrinter,
        List<ScoredDevice> rankedPrinters,
        boolean complete,
        Duration discoveryDuration) {

    public SmartDiscoveryResult {
        rankedPrinters = ImmutableList.copyOf(rankedPrinters);
    }

    public Optional<PrinterDevice> getSelected() {
        return Optional.ofNullable(selectedPrinter);
    }

    public List<PrinterDevice> sortedPrinters() {
        return rankedPrinters.stream().map(ScoredDevice::device).collect(ImmutableList.toImmutableList());
    }
}
