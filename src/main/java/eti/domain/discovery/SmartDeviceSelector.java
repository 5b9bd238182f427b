package eti.domain.discovery;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import eti.common.ETransportType;
import io.reactivex.rxjava3.core.Observable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scores discovered printers and picks a default target.
 * History and the previous selection are owned by the caller and passed in.
 *
 * @since 16/10/2026
 */
public class SmartDeviceSelector {
    private static final Logger logger = LoggerFactory.getLogger(SmartDeviceSelector.class);

    private final IConnectionHistoryStore historyStore;
    private final SelectorWeights weights;
    private volatile ETransportType preferredTransport;
    private volatile PrinterDevice previousSelection;

    public SmartDeviceSelector(IConnectionHistoryStore historyStore, ETransportType preferredTransport) {
        this(historyStore, preferredTransport, SelectorWeights.defaults());
    }

    public SmartDeviceSelector(IConnectionHistoryStore historyStore, ETransportType preferredTransport,
                               SelectorWeights weights) {
        this.historyStore = historyStore;
        this.preferredTransport = preferredTransport;
        this.weights = weights;
    }

    /**
     * Pick the highest scoring device. An empty list yields no selection.
     */
    public SmartDiscoveryResult select(List<PrinterDevice> devices) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<ScoredDevice> ranked = rank(devices);
        if (ranked.isEmpty()) {
            return new SmartDiscoveryResult(null, ranked, true, stopwatch.elapsed());
        }

        PrinterDevice previous = previousSelection;
        PrinterDevice selected = previous != null && devices.contains(previous)
                ? devices.get(devices.indexOf(previous))
                : ranked.get(0).device();

        logger.info("Selected printer {} ({}) from {} candidates", selected.name(), selected.address(), devices.size());
        return new SmartDiscoveryResult(selected, ranked, true, stopwatch.elapsed());
    }

    /**
     * Re-rank each discovery snapshot as it arrives. When discovery completes, one final
     * result marked complete is emitted for the last snapshot.
     */
    public Observable<SmartDiscoveryResult> selectFromStream(Observable<List<PrinterDevice>> discoveries) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        AtomicReference<SmartDiscoveryResult> latest = new AtomicReference<>();
        return discoveries
                .map(devices -> {
                    SmartDiscoveryResult result = select(devices);
                    SmartDiscoveryResult interim = new SmartDiscoveryResult(result.selectedPrinter(),
                            result.rankedPrinters(), false, stopwatch.elapsed());
                    latest.set(interim);
                    return interim;
                })
                .concatWith(Observable.defer(() -> {
                    SmartDiscoveryResult last = latest.get();
                    return Observable.just(last == null
                            ? new SmartDiscoveryResult(null, ImmutableList.of(), true, stopwatch.elapsed())
                            : new SmartDiscoveryResult(last.selectedPrinter(), last.rankedPrinters(),
                            true, stopwatch.elapsed()));
                }));
    }

    /**
     * Devices sorted by descending score; ties keep input order
     */
    public List<ScoredDevice> rank(List<PrinterDevice> devices) {
        if (devices == null || devices.isEmpty()) {
            return ImmutableList.of();
        }
        List<ScoredDevice> scored = new ArrayList<>(devices.size());
        for (PrinterDevice device : devices) {
            scored.add(new ScoredDevice(device, score(device)));
        }
        scored.sort(Comparator.comparingInt(ScoredDevice::score).reversed());
        return ImmutableList.copyOf(scored);
    }

    public int score(PrinterDevice device) {
        int score = 0;
        PrinterDevice previous = previousSelection;
        if (previous != null && previous.equals(device)) {
            score += weights.previousSelectionBonus();
        }
        score += device.transportType() == preferredTransport
                ? weights.preferredTransportScore()
                : weights.otherTransportScore();
        score += weights.modelScore(device.name());
        score += weights.availabilityScore(device);
        score += weights.historyScore(historyStore.getSuccessCount(device.address()));
        return score;
    }

    public void recordSuccessfulConnection(String address) {
        int count = historyStore.incrementSuccessCount(address);
        logger.debug("Recorded successful connection to {} (total {})", address, count);
    }

    public void setPreviousSelection(PrinterDevice device) {
        this.previousSelection = device;
    }

    public PrinterDevice getPreviousSelection() {
        return previousSelection;
    }

    public void setPreferredTransport(ETransportType preferredTransport) {
        this.preferredTransport = preferredTransport;
    }

    public ETransportType getPreferredTransport() {
        return preferredTransport;
    }
}
