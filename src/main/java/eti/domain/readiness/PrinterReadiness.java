package eti.domain.readiness;

import com.google.common.collect.ImmutableList;
import eti.domain.ErrorInfo;
import eti.domain.Result;
import eti.domain.protocol.HostStatusInfo;
import eti.domain.protocol.StatusParser;
import eti.domain.transport.PrinterChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lazily evaluated, cached printer readiness.
 *
 * <p>Each dimension is queried on first access and cached until reset. Concurrent first
 * accesses share one pending future, so a dimension never has more than one query in flight.
 * {@link #isReady()} and the other derived views only read what is cached.</p>
 *
 * @since 15/10/2026
 */
public class PrinterReadiness {
    private static final Logger logger = LoggerFactory.getLogger(PrinterReadiness.class);

    private final PrinterChannel channel;
    private final ReadinessOptions options;
    private final Executor executor;
    private final Map<EReadinessDimension, AtomicReference<CompletableFuture<DimensionState>>> cache =
            new EnumMap<>(EReadinessDimension.class);
    private volatile long lastCheckTime;

    public PrinterReadiness(PrinterChannel channel, ReadinessOptions options) {
        this(channel, options, Runnable::run);
    }

    /**
     * @param executor runs dimension queries during {@link #readAllStatuses()}
     */
    public PrinterReadiness(PrinterChannel channel, ReadinessOptions options, Executor executor) {
        this.channel = channel;
        this.options = options;
        this.executor = executor;
        for (EReadinessDimension dimension : EReadinessDimension.values()) {
            cache.put(dimension, new AtomicReference<>());
        }
    }

    public ReadinessOptions getOptions() {
        return options;
    }

    // ========== Lazy access ==========

    /**
     * Cached state of the dimension, querying the printer on first access.
     * Dimensions not configured as checked stay unchecked and are never queried.
     */
    public DimensionState ensure(EReadinessDimension dimension) {
        return ensureAsync(dimension).join();
    }

    public CompletableFuture<DimensionState> ensureAsync(EReadinessDimension dimension) {
        if (!options.isChecked(dimension)) {
            return CompletableFuture.completedFuture(DimensionState.unchecked());
        }

        AtomicReference<CompletableFuture<DimensionState>> slot = cache.get(dimension);
        CompletableFuture<DimensionState> existing = slot.get();
        if (existing != null) {
            return existing;
        }

        CompletableFuture<DimensionState> pending = new CompletableFuture<>();
        if (!slot.compareAndSet(null, pending)) {
            return slot.get();
        }

        try {
            pending.complete(query(dimension));
        } catch (RuntimeException e) {
            logger.error("Unexpected error checking {}: {}", dimension, e.getMessage());
            pending.complete(DimensionState.bad(null, "Check failed: " + e.getMessage()));
        }
        lastCheckTime = System.currentTimeMillis();
        return pending;
    }

    /**
     * Populate every configured dimension in one batch
     */
    public void readAllStatuses() {
        List<CompletableFuture<DimensionState>> futures = new ArrayList<>();
        for (EReadinessDimension dimension : EReadinessDimension.values()) {
            if (options.isChecked(dimension)) {
                futures.add(CompletableFuture.supplyAsync(() -> ensure(dimension), executor));
            }
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        logger.debug("Readiness read: {}", this);
    }

    public void resetDimension(EReadinessDimension dimension) {
        cache.get(dimension).set(null);
        logger.debug("Reset readiness dimension {}", dimension);
    }

    public void resetAll() {
        cache.values().forEach(slot -> slot.set(null));
        logger.debug("Reset all readiness dimensions");
    }

    // ========== Cached views (never query) ==========

    /**
     * Cached state, or unchecked while nothing has completed
     */
    public DimensionState getState(EReadinessDimension dimension) {
        CompletableFuture<DimensionState> future = cache.get(dimension).get();
        if (future == null || !future.isDone()) {
            return DimensionState.unchecked();
        }
        return future.join();
    }

    /**
     * True when every configured dimension has been checked and is good
     */
    public boolean isReady() {
        for (EReadinessDimension dimension : EReadinessDimension.values()) {
            if (options.isChecked(dimension) && !getState(dimension).isGood()) {
                return false;
            }
        }
        return true;
    }

    public Boolean isConnected() {
        DimensionState state = getState(EReadinessDimension.CONNECTION);
        return state.isChecked() && !state.isQueryFailed() ? state.isGood() : null;
    }

    public Boolean hasMedia() {
        return StatusParser.parseMediaPresent(getState(EReadinessDimension.MEDIA).getValue());
    }

    public Boolean isHeadClosed() {
        return StatusParser.parseHeadClosed(getState(EReadinessDimension.HEAD).getValue());
    }

    public Boolean isPaused() {
        return StatusParser.toBool(getState(EReadinessDimension.PAUSE).getValue());
    }

    public String getLanguage() {
        return getState(EReadinessDimension.LANGUAGE).getValue();
    }

    public HostStatusInfo getHostStatus() {
        return getState(EReadinessDimension.HOST_ERRORS).getHostStatus();
    }

    /**
     * Errors reported by the printer's host status
     */
    public List<String> getErrors() {
        DimensionState host = getState(EReadinessDimension.HOST_ERRORS);
        if (!host.isBad()) {
            return ImmutableList.of();
        }

        ImmutableList.Builder<String> errors = ImmutableList.builder();
        if (host.isQueryFailed()) {
            ErrorInfo error = host.getError();
            errors.add(error.getMessage());
            errors.add("Error code: " + error.getCode());
            return errors.build();
        }

        HostStatusInfo info = host.getHostStatus();
        if (info.getErrorMessage() != null) {
            errors.add(info.getErrorMessage());
        }
        if (info.getErrorCode() != null && info.getErrorCode() != 0) {
            errors.add("Error code: " + info.getErrorCode());
        }
        if (info.isPaperOut()) {
            errors.add("Out of paper");
        }
        if (info.isRibbonOut()) {
            errors.add("Out of ribbon");
        }
        if (info.isHeadOpen()) {
            errors.add("Print head open");
        }
        if (info.isHeadCold()) {
            errors.add("Print head cold");
        }
        if (info.isHeadTooHot()) {
            errors.add("Print head overheated");
        }
        return errors.build();
    }

    /**
     * Conditions that could not be verified
     */
    public List<String> getWarnings() {
        ImmutableList.Builder<String> warnings = ImmutableList.builder();
        for (EReadinessDimension dimension : EReadinessDimension.values()) {
            DimensionState state = getState(dimension);
            if (dimension == EReadinessDimension.HOST_ERRORS || !state.isBad()) {
                continue;
            }
            if (state.isQueryFailed()) {
                warnings.add(dimension + " check failed: " + state.getDetail());
            } else if (dimension == EReadinessDimension.LANGUAGE) {
                warnings.add(state.getDetail());
            }
        }
        return warnings.build();
    }

    /**
     * Human readable names of the faults that prevent printing
     */
    public List<String> getBlockingIssues() {
        ImmutableList.Builder<String> issues = ImmutableList.builder();
        for (EReadinessDimension dimension : EReadinessDimension.values()) {
            DimensionState state = getState(dimension);
            if (!options.isChecked(dimension) || !state.isBad()) {
                continue;
            }
            if (dimension == EReadinessDimension.HOST_ERRORS && state.getHostStatus() != null) {
                issues.addAll(hostIssues(state.getHostStatus()));
            } else if (state.isQueryFailed()) {
                issues.add(dimension.getIssueName() + ": " + state.getDetail());
            } else {
                issues.add(dimension.getIssueName());
            }
        }
        return issues.build();
    }

    private static List<String> hostIssues(HostStatusInfo info) {
        List<String> issues = new ArrayList<>();
        if (info.isPaperOut()) {
            issues.add("Out of Paper");
        }
        if (info.isRibbonOut()) {
            issues.add("Out of Ribbon");
        }
        if (info.isHeadOpen()) {
            issues.add("Head Open");
        }
        if (info.isHeadCold()) {
            issues.add("Head Too Cold");
        }
        if (info.isHeadTooHot()) {
            issues.add("Head Too Hot");
        }
        if (issues.isEmpty()) {
            issues.add(EReadinessDimension.HOST_ERRORS.getIssueName() + ": " + info.getErrorMessage());
        }
        return issues;
    }

    public long getLastCheckTime() {
        return lastCheckTime;
    }

    // ========== Queries ==========

    private DimensionState query(EReadinessDimension dimension) {
        logger.debug("Checking readiness dimension {}", dimension);
        if (dimension == EReadinessDimension.CONNECTION) {
            Result<Boolean> connected = channel.isConnected();
            if (connected.isFailure()) {
                return DimensionState.failed(connected.getError());
            }
            return Boolean.TRUE.equals(connected.getData())
                    ? DimensionState.good("connected")
                    : DimensionState.bad("disconnected", "Not connected");
        }

        Result<String> response = channel.getSetting(dimension.getSettingKey());
        if (response.isFailure()) {
            logger.warn("Readiness query {} failed: {}", dimension, response.getError().getMessage());
            return DimensionState.failed(response.getError());
        }
        return interpret(dimension, response.getData());
    }

    static DimensionState interpret(EReadinessDimension dimension, String value) {
        return switch (dimension) {
            case MEDIA -> fromFlag(value, StatusParser.parseMediaPresent(value),
                    "Out of paper", "Unrecognized media status");
            case HEAD -> fromFlag(value, StatusParser.parseHeadClosed(value),
                    "Print head open", "Unrecognized head latch state");
            case PAUSE -> {
                Boolean paused = StatusParser.toBool(value);
                yield fromFlag(value, paused != null ? !paused : null,
                        "Printer paused", "Unrecognized pause state");
            }
            case HOST_ERRORS -> DimensionState.host(value, StatusParser.parseHostStatus(value));
            case LANGUAGE -> value != null
                    ? DimensionState.good(value)
                    : DimensionState.bad(null, "Printer language could not be determined");
            case CONNECTION -> throw new IllegalArgumentException("Connection is not a setting query");
        };
    }

    private static DimensionState fromFlag(String value, Boolean healthy, String faultDetail, String unknownDetail) {
        if (healthy == null) {
            return DimensionState.bad(value, unknownDetail + ": " + value);
        }
        return healthy ? DimensionState.good(value) : DimensionState.bad(value, faultDetail);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PrinterReadiness{");
        for (EReadinessDimension dimension : EReadinessDimension.values()) {
            if (options.isChecked(dimension)) {
                sb.append(dimension).append('=').append(getState(dimension)).append(", ");
            }
        }
        return sb.append("ready=").append(isReady()).append('}').toString();
    }
}
