package eti.domain.print;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import eti.common.EPrintLanguage;
import eti.common.SgdConstants;
import eti.dal.WorkflowConfig;
import eti.domain.CancellationToken;
import eti.domain.ErrorCode;
import eti.domain.ErrorInfo;
import eti.domain.ISleeper;
import eti.domain.Result;
import eti.domain.correction.AutoCorrector;
import eti.domain.discovery.PrinterDevice;
import eti.domain.discovery.SmartDeviceSelector;
import eti.domain.policy.TimeoutPolicy;
import eti.domain.protocol.SgdCodec;
import eti.domain.readiness.CorrectedReadiness;
import eti.domain.readiness.DimensionState;
import eti.domain.readiness.EReadinessDimension;
import eti.domain.readiness.PrinterReadiness;
import eti.domain.readiness.ReadinessOptions;
import eti.domain.transport.IPrinterTransport;
import eti.domain.transport.PrinterChannel;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.subjects.PublishSubject;
import io.reactivex.rxjava3.subjects.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Print job state machine.
 *
 * <p>Steps run {@code initializing -> validating -> connecting -> connected -> checking-status
 * -> sending -> waiting-for-completion -> completed}. Recoverable failures re-enter
 * {@code connecting} until attempts run out. Cancellation is cooperative and checked between
 * steps and while waiting; data already sent is never re-sent.</p>
 *
 * <p>One job runs at a time. Events are published on {@link #getEvents()} and nothing is
 * published after a run's terminal event.</p>
 *
 * @since 16/10/2026
 */
@Singleton
public class PrintWorkflow {
    private static final Logger logger = LoggerFactory.getLogger(PrintWorkflow.class);

    static final long WAIT_POLL_INTERVAL_MS = 100;
    static final int PROGRESS_EVERY_POLLS = 5;

    private final PrinterChannel channel;
    private final SmartDeviceSelector selector;
    private final ISleeper sleeper;
    private final Executor executor;
    private final ReentrantLock runLock = new ReentrantLock();
    private final Subject<PrintEvent> eventSubject = PublishSubject.<PrintEvent>create().toSerialized();
    private final List<PrintEvent> runEvents = new CopyOnWriteArrayList<>();

    private volatile PrintState state = PrintState.idle();
    private volatile CancellationToken currentToken = new CancellationToken();
    private volatile boolean terminated;
    private volatile String connectedAddress;
    private Stopwatch stopwatch = Stopwatch.createUnstarted();

    @Inject
    public PrintWorkflow(IPrinterTransport transport, TimeoutPolicy timeoutPolicy, SmartDeviceSelector selector,
                         WorkflowConfig config, ExecutorService executor) {
        this(new PrinterChannel(transport, timeoutPolicy, config.commandTimeoutMs()), selector, ISleeper.SYSTEM, executor);
    }

    public PrintWorkflow(PrinterChannel channel, SmartDeviceSelector selector, ISleeper sleeper, Executor executor) {
        this.channel = channel;
        this.selector = selector;
        this.sleeper = sleeper;
        this.executor = executor;
    }

    // ========== Public API ==========

    /**
     * Run one print job to a terminal state
     */
    public Result<Void> print(String data, PrinterDevice device, PrintOptions options) {
        if (!runLock.tryLock()) {
            logger.warn("Print request rejected, another job is running");
            return Result.failure(ErrorCode.OPERATION_ERROR, "A print job is already running");
        }
        try {
            CancellationToken token = new CancellationToken();
            currentToken = token;
            return run(data, device, options, token);
        } finally {
            runLock.unlock();
        }
    }

    public CompletableFuture<Result<Void>> printAsync(String data, PrinterDevice device, PrintOptions options) {
        return CompletableFuture.supplyAsync(() -> print(data, device, options), executor);
    }

    /**
     * Print jobs one after another
     * @return number of jobs printed
     */
    public Result<Integer> printBatch(List<String> jobs, PrinterDevice device, BatchPrintOptions options) {
        int printed = 0;
        for (int i = 0; i < jobs.size(); i++) {
            if (i > 0 && options.delayBetweenJobsMs() > 0) {
                try {
                    sleeper.sleep(options.delayBetweenJobsMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return Result.failure(ErrorCode.OPERATION_CANCELLED);
                }
            }

            Result<Void> result = print(jobs.get(i), device, options.printOptions());
            if (result.isSuccess()) {
                printed++;
                continue;
            }
            if (result.getError().is(ErrorCode.OPERATION_CANCELLED) || options.stopOnError()) {
                logger.warn("Batch stopped at job {}/{}: {}", i + 1, jobs.size(), result.getError().getMessage());
                return result.propagate();
            }
            logger.warn("Batch job {}/{} failed, continuing: {}", i + 1, jobs.size(), result.getError().getMessage());
        }
        logger.info("Batch finished: {}/{} jobs printed", printed, jobs.size());
        return Result.success(printed);
    }

    /**
     * Request cancellation of the running job
     */
    public void cancel() {
        logger.info("Cancellation requested");
        currentToken.cancel();
    }

    public PrintState getState() {
        return state;
    }

    public Observable<PrintEvent> getEvents() {
        return eventSubject.hide();
    }

    /**
     * Events of the current or most recent run, in order
     */
    public List<PrintEvent> getLastRunEvents() {
        return ImmutableList.copyOf(runEvents);
    }

    public Result<Void> disconnect() {
        connectedAddress = null;
        return channel.disconnect();
    }

    // ========== Run ==========

    private Result<Void> run(String data, PrinterDevice device, PrintOptions options, CancellationToken token) {
        runEvents.clear();
        terminated = false;
        stopwatch = Stopwatch.createStarted();
        state = PrintState.started(options.maxAttempts());

        transition(EPrintStep.INITIALIZING, "Initializing print job");
        if (token.isCancelled()) {
            return cancelled();
        }

        transition(EPrintStep.VALIDATING, "Validating print data");
        Result<EPrintLanguage> validated = validate(data, device, options);
        if (validated.isFailure()) {
            PrintErrorInfo error = ErrorClassifier.toPrintError(validated.getError());
            emit(PrintEvent.errorOccurred(error));
            return fail(error);
        }
        EPrintLanguage language = validated.getData();
        logger.info("Printing {} bytes of {} to {} ({})", data.length(), language, device.name(), device.address());

        PrintErrorInfo lastError = null;
        for (int attempt = 1; attempt <= options.maxAttempts(); attempt++) {
            state = state.withAttempt(attempt).withError(null);

            Result<Void> outcome = runAttempt(data, language, device, options, token);
            if (outcome.isSuccess()) {
                return complete();
            }
            if (token.isCancelled()) {
                return cancelled();
            }

            lastError = ErrorClassifier.toPrintError(outcome.getError());
            state = state.withError(lastError);
            emit(PrintEvent.errorOccurred(lastError));

            if (!lastError.recoverability().isRetryable() || attempt == options.maxAttempts()) {
                break;
            }

            long delay = options.retryDelayFor(attempt);
            logger.warn("Attempt {}/{} failed ({}), retrying in {}ms",
                    attempt, options.maxAttempts(), lastError.message(), delay);
            emit(PrintEvent.retryAttempt(new RetryAttemptInfo(attempt + 1, options.maxAttempts(), delay,
                    lastError.message())));
            if (!waitCancellable(delay, token)) {
                return cancelled();
            }
        }
        return fail(lastError);
    }

    private Result<Void> runAttempt(String data, EPrintLanguage language, PrinterDevice device,
                                    PrintOptions options, CancellationToken token) {
        if (token.isCancelled()) {
            return Result.failure(ErrorCode.OPERATION_CANCELLED);
        }
        transition(EPrintStep.CONNECTING, "Connecting to " + device.name(),
                ImmutableMap.of("address", device.address()));
        Result<Void> connected = ensureConnected(device.address());
        if (connected.isFailure()) {
            return connected;
        }

        if (token.isCancelled()) {
            return Result.failure(ErrorCode.OPERATION_CANCELLED);
        }
        transition(EPrintStep.CONNECTED, "Connected to " + device.name());
        if (selector != null) {
            selector.recordSuccessfulConnection(device.address());
        }

        if (options.checkStatus()) {
            if (token.isCancelled()) {
                return Result.failure(ErrorCode.OPERATION_CANCELLED);
            }
            transition(EPrintStep.CHECKING_STATUS, "Checking printer status");
            Result<Void> status = checkStatus(data, options);
            if (status.isFailure()) {
                return status;
            }
        }

        if (token.isCancelled()) {
            return Result.failure(ErrorCode.OPERATION_CANCELLED);
        }
        transition(EPrintStep.SENDING, "Sending print data",
                ImmutableMap.of("bytes", data.getBytes(StandardCharsets.UTF_8).length, "language", language));
        Result<Void> sent = channel.sendBytes(data.getBytes(StandardCharsets.UTF_8));
        if (sent.isFailure()) {
            return sent;
        }
        long sentAt = stopwatch.elapsed(TimeUnit.MILLISECONDS);

        if (options.flushAfterSend()) {
            Result<Void> flushed = channel.sendBytes(new byte[]{SgdConstants.FLUSH_BUFFER});
            if (flushed.isFailure()) {
                logger.warn("Buffer flush after send failed: {}", flushed.getError().getMessage());
            }
        }

        if (options.waitForCompletion()) {
            if (token.isCancelled()) {
                return Result.failure(ErrorCode.OPERATION_CANCELLED);
            }
            transition(EPrintStep.WAITING_FOR_COMPLETION, "Waiting for print to complete");
            if (!waitForCompletion(data.length(), language, options, sentAt, token)) {
                return Result.failure(ErrorCode.OPERATION_CANCELLED);
            }
        }
        return Result.success();
    }

    private Result<EPrintLanguage> validate(String data, PrinterDevice device, PrintOptions options) {
        if (data == null || data.isEmpty()) {
            return Result.failure(ErrorCode.EMPTY_DATA);
        }
        int size = data.getBytes(StandardCharsets.UTF_8).length;
        if (size > options.maxDataSize()) {
            return Result.failure(ErrorCode.PRINT_DATA_TOO_LARGE, size);
        }
        if (device == null) {
            return Result.failure(ErrorCode.INVALID_DATA, "No printer selected");
        }
        EPrintLanguage language = SgdCodec.detectLanguage(data);
        if (language == EPrintLanguage.UNDETERMINED && !options.allowUndeterminedLanguage()) {
            return Result.failure(ErrorCode.PRINT_DATA_INVALID_FORMAT);
        }
        return Result.success(language);
    }

    private Result<Void> ensureConnected(String address) {
        Result<Boolean> current = channel.isConnected();
        if (current.isSuccess() && Boolean.TRUE.equals(current.getData()) && address.equals(connectedAddress)) {
            return Result.success();
        }
        Result<Void> connected = channel.connect(address);
        connectedAddress = connected.isSuccess() ? address : null;
        return connected;
    }

    private Result<Void> checkStatus(String data, PrintOptions options) {
        ReadinessOptions readinessOptions = options.readinessOptions();
        PrinterReadiness readiness = new PrinterReadiness(channel, readinessOptions, executor);
        readiness.readAllStatuses();
        publishStatus(readiness, "Printer status checked");

        if (options.autoCorrect() && readinessOptions.hasAnyFix()) {
            AutoCorrector corrector = new AutoCorrector(channel, readinessOptions.toCorrectionOptions(), sleeper,
                    message -> emit(PrintEvent.statusUpdate(new StatusUpdateInfo(message, state.getIssues(), false))));

            if (!readiness.isReady()) {
                CorrectedReadiness corrected = corrector.correct(readiness);
                if (corrected.hasCorrections()) {
                    readiness.readAllStatuses();
                    publishStatus(readiness, corrected.correctionSummary());
                }
            }

            if (readinessOptions.fixLanguageMismatch()) {
                Result<Boolean> switched = corrector.switchLanguageForData(data, readiness);
                if (switched.isFailure()) {
                    return switched.propagate();
                }
                readiness.readAllStatuses();
            }
        }

        if (readiness.isReady()) {
            return Result.success();
        }

        // A failed query is forwarded as reported by the transport
        for (EReadinessDimension dimension : EReadinessDimension.values()) {
            DimensionState dimensionState = readiness.getState(dimension);
            if (readinessOptions.isChecked(dimension) && dimensionState.isQueryFailed()) {
                return Result.failure(dimensionState.getError());
            }
        }
        List<String> issues = readiness.getBlockingIssues();
        logger.warn("Printer not ready: {}", issues);
        return Result.failure(ErrorInfo.of(ErrorCode.BLOCKING_ISSUES, String.join(", ", issues)));
    }

    private void publishStatus(PrinterReadiness readiness, String message) {
        List<String> issues = readiness.getBlockingIssues();
        state = state.withIssues(issues);
        emit(PrintEvent.statusUpdate(new StatusUpdateInfo(message, issues, readiness.isReady())));
    }

    /**
     * @return false when cancelled while waiting
     */
    private boolean waitForCompletion(int dataLength, EPrintLanguage language, PrintOptions options,
                                      long sentAt, CancellationToken token) {
        long estimate = DwellTimeEstimator.estimate(dataLength, language, options.maxWaitMs());
        long remaining = DwellTimeEstimator.remaining(estimate, stopwatch.elapsed(TimeUnit.MILLISECONDS) - sentAt);
        if (remaining == 0) {
            logger.debug("Dwell estimate of {}ms already elapsed", estimate);
            return true;
        }
        logger.debug("Waiting {}ms for print completion (estimate {}ms)", remaining, estimate);

        double start = EPrintStep.WAITING_FOR_COMPLETION.getProgress();
        double span = EPrintStep.COMPLETED.getProgress() - start;
        long waited = 0;
        int polls = 0;
        while (waited < remaining) {
            long chunk = Math.min(WAIT_POLL_INTERVAL_MS, remaining - waited);
            if (!sleepChunk(chunk, token)) {
                return false;
            }
            waited += chunk;
            if (token.isCancelled()) {
                return false;
            }
            if (++polls % PROGRESS_EVERY_POLLS == 0 && waited < remaining) {
                state = state.withProgress(start + span * waited / remaining);
                emit(PrintEvent.progressUpdate(new PrintProgressInfo(state.getProgress(), "Printing",
                        stopwatch.elapsed(), Duration.ofMillis(remaining - waited))));
            }
        }
        return true;
    }

    private boolean waitCancellable(long delayMs, CancellationToken token) {
        long waited = 0;
        while (waited < delayMs) {
            long chunk = Math.min(WAIT_POLL_INTERVAL_MS, delayMs - waited);
            if (!sleepChunk(chunk, token)) {
                return false;
            }
            waited += chunk;
            if (token.isCancelled()) {
                return false;
            }
        }
        return !token.isCancelled();
    }

    private boolean sleepChunk(long millis, CancellationToken token) {
        try {
            sleeper.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            return false;
        }
    }

    // ========== Transitions ==========

    private void transition(EPrintStep step, String message) {
        transition(step, message, ImmutableMap.of());
    }

    private void transition(EPrintStep step, String message, Map<String, Object> metadata) {
        EPrintStep previous = state.getStep();
        state = state.withStep(step);
        logger.debug("Print step {} -> {}: {}", previous, step, message);
        emit(PrintEvent.stepChanged(stepInfo(step, message, metadata)));
    }

    private Result<Void> complete() {
        transition(EPrintStep.COMPLETED, "Print completed");
        logger.info("Print job completed in {}ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));
        emitTerminal(PrintEvent.completed(stepInfo(EPrintStep.COMPLETED, "Print completed", ImmutableMap.of())));
        return Result.success();
    }

    private Result<Void> cancelled() {
        transition(EPrintStep.CANCELLED, "Print cancelled");
        logger.info("Print job cancelled at attempt {}/{}", state.getAttempt(), state.getMaxAttempts());
        emitTerminal(PrintEvent.cancelled(stepInfo(EPrintStep.CANCELLED, "Print cancelled", ImmutableMap.of())));
        return Result.failure(ErrorCode.OPERATION_CANCELLED);
    }

    private Result<Void> fail(PrintErrorInfo error) {
        state = state.withError(error);
        transition(EPrintStep.FAILED, error.message(),
                ImmutableMap.of("errorCode", error.errorCode(), "recoverability", error.recoverability()));
        terminated = true;
        logger.error("Print job failed: {} [{}] ({})", error.message(), error.errorCode(), error.recoverability());
        return Result.failure(error.error());
    }

    private PrintStepInfo stepInfo(EPrintStep step, String message, Map<String, Object> metadata) {
        return new PrintStepInfo(step, message, state.getAttempt(), state.getMaxAttempts(),
                stopwatch.elapsed(), state.getProgress(), metadata);
    }

    private void emitTerminal(PrintEvent event) {
        emit(event);
        terminated = true;
    }

    private void emit(PrintEvent event) {
        if (terminated) {
            logger.debug("Dropping event after terminal state: {}", event);
            return;
        }
        runEvents.add(event);
        try {
            eventSubject.onNext(event);
        } catch (RuntimeException e) {
            logger.error("Error notifying event subscriber: {}", e.getMessage());
        }
    }
}
