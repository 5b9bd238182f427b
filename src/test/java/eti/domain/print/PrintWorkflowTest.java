package eti.domain.print;

import eti.common.EPrintLanguage;
import eti.common.ETransportType;
import eti.common.SgdConstants;
import eti.domain.ErrorCode;
import eti.domain.RecordingSleeper;
import eti.domain.Result;
import eti.domain.discovery.InMemoryConnectionHistoryStore;
import eti.domain.discovery.PrinterDevice;
import eti.domain.discovery.SmartDeviceSelector;
import eti.domain.policy.TimeoutPolicy;
import eti.domain.readiness.ReadinessOptions;
import eti.domain.transport.DummyPrinterTransport;
import eti.domain.transport.IPrinterTransport;
import eti.domain.transport.PrinterChannel;
import io.reactivex.rxjava3.observers.TestObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for PrintWorkflow, driven against the dummy transport with a recording sleeper
 */
class PrintWorkflowTest {

    private static final String ZPL_LABEL = "^XA^FO50,50^A0N,30,30^FDShipping label^FS^XZ";
    private static final String CPCL_LABEL = "! 0 200 200 210 1\r\nTEXT 4 0 30 40 Hello\r\nPRINT\r\n";

    private TimeoutPolicy timeoutPolicy;
    private DummyPrinterTransport transport;
    private InMemoryConnectionHistoryStore history;
    private RecordingSleeper sleeper;
    private PrintWorkflow workflow;
    private PrinterDevice device;

    @BeforeEach
    void setUp() {
        timeoutPolicy = new TimeoutPolicy();
        transport = new DummyPrinterTransport();
        history = new InMemoryConnectionHistoryStore();
        sleeper = new RecordingSleeper();
        workflow = createWorkflow(transport);
        device = PrinterDevice.network("192.168.1.20:9100", "ZQ520");
    }

    @AfterEach
    void tearDown() {
        timeoutPolicy.shutdown();
    }

    private PrintWorkflow createWorkflow(IPrinterTransport printerTransport) {
        return new PrintWorkflow(new PrinterChannel(printerTransport, timeoutPolicy, 2000),
                new SmartDeviceSelector(history, ETransportType.NETWORK), sleeper, Runnable::run);
    }

    private static List<EPrintStep> steps(List<PrintEvent> events) {
        return events.stream()
                .filter(event -> event.getType() == EPrintEventType.STEP_CHANGED)
                .map(event -> event.getStepInfo().step())
                .collect(Collectors.toList());
    }

    private static List<EPrintEventType> types(List<PrintEvent> events) {
        return events.stream().map(PrintEvent::getType).collect(Collectors.toList());
    }

    private static PrintEvent last(List<PrintEvent> events) {
        return events.get(events.size() - 1);
    }

    // ========== Happy Path Tests ==========

    @Test
    @DisplayName("Should walk every step and complete on a healthy printer")
    void shouldCompleteOnHealthyPrinter() {
        // When
        Result<Void> result = workflow.print(ZPL_LABEL, device, PrintOptions.defaults());

        // Then
        List<PrintEvent> events = workflow.getLastRunEvents();
        assertThat(result.isSuccess()).isTrue();
        assertThat(steps(events)).containsExactly(
                EPrintStep.INITIALIZING, EPrintStep.VALIDATING, EPrintStep.CONNECTING, EPrintStep.CONNECTED,
                EPrintStep.CHECKING_STATUS, EPrintStep.SENDING, EPrintStep.WAITING_FOR_COMPLETION,
                EPrintStep.COMPLETED);
        assertThat(last(events).getType()).isEqualTo(EPrintEventType.COMPLETED);
        assertThat(events).filteredOn(PrintEvent::isTerminal).hasSize(1);
        assertThat(transport.getReceivedText()).containsExactly(ZPL_LABEL);
        assertThat(transport.getConnectedAddress()).isEqualTo(device.address());
        assertThat(history.getSuccessCount(device.address())).isEqualTo(1);
        assertThat(workflow.getState().isCompleted()).isTrue();
        assertThat(workflow.getState().getProgress()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should report fixed progress per step")
    void shouldReportFixedProgressPerStep() {
        // When
        workflow.print(ZPL_LABEL, device, PrintOptions.defaults());

        // Then
        List<PrintStepInfo> infos = workflow.getLastRunEvents().stream()
                .filter(event -> event.getType() == EPrintEventType.STEP_CHANGED)
                .map(PrintEvent::getStepInfo)
                .collect(Collectors.toList());
        assertThat(infos).allSatisfy(info -> assertThat(info.progress()).isEqualTo(info.step().getProgress()));
        assertThat(infos.get(2).attempt()).isEqualTo(1);
        assertThat(infos.get(2).maxAttempts()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should wait the dwell estimate in chunks and publish progress")
    void shouldWaitDwellEstimate() {
        // When
        workflow.print(ZPL_LABEL, device, PrintOptions.defaults());

        // Then
        long estimate = DwellTimeEstimator.estimate(ZPL_LABEL.length(), EPrintLanguage.ZPL, 60000);
        assertThat(sleeper.getTotalDelay()).isPositive().isLessThanOrEqualTo(estimate);
        assertThat(sleeper.getDelays()).allSatisfy(delay ->
                assertThat(delay).isLessThanOrEqualTo(PrintWorkflow.WAIT_POLL_INTERVAL_MS));
        assertThat(types(workflow.getLastRunEvents())).contains(EPrintEventType.PROGRESS_UPDATE);
    }

    @Test
    @DisplayName("Should skip waiting when completion wait is disabled")
    void shouldSkipWaitingWhenDisabled() {
        // When
        Result<Void> result = workflow.print(ZPL_LABEL, device, PrintOptions.defaults().withWaitForCompletion(false));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(steps(workflow.getLastRunEvents())).doesNotContain(EPrintStep.WAITING_FOR_COMPLETION);
        assertThat(sleeper.getDelays()).isEmpty();
    }

    @Test
    @DisplayName("Should send the flush byte after the payload when requested")
    void shouldFlushAfterSend() {
        // Given
        PrintOptions base = PrintOptions.defaults();
        PrintOptions flushing = new PrintOptions(base.maxAttempts(), base.retryDelayMs(), base.maxRetryDelayMs(),
                base.checkStatus(), base.autoCorrect(), base.readinessOptions(), false, base.maxWaitMs(),
                base.maxDataSize(), false, true);

        // When
        workflow.print(ZPL_LABEL, device, flushing);

        // Then
        List<byte[]> received = transport.getReceived();
        assertThat(received).hasSize(2);
        assertThat(received.get(1)).containsExactly(SgdConstants.FLUSH_BUFFER);
    }

    @Test
    @DisplayName("Should publish the same events to subscribers")
    void shouldPublishEventsToSubscribers() {
        // Given
        TestObserver<PrintEvent> observer = workflow.getEvents().test();

        // When
        workflow.print(ZPL_LABEL, device, PrintOptions.defaults().withWaitForCompletion(false));

        // Then
        assertThat(observer.values()).containsExactlyElementsOf(workflow.getLastRunEvents());
        observer.dispose();
    }

    // ========== Language Tests ==========

    @Test
    @DisplayName("Should switch a line print printer to ZPL before sending")
    void shouldSwitchLanguageBeforeSending() {
        // Given
        transport.setSetting(SgdConstants.KEY_LANGUAGES, "line_print");

        // When
        Result<Void> result = workflow.print(ZPL_LABEL, device, PrintOptions.defaults());

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(transport.getSetting(SgdConstants.KEY_LANGUAGES)).isEqualTo("zpl");
        assertThat(transport.getReceivedText()).containsExactly(
                "! U1 setvar \"device.languages\" \"zpl\"\r\n", ZPL_LABEL);
        assertThat(workflow.getLastRunEvents())
                .filteredOn(event -> event.getType() == EPrintEventType.STATUS_UPDATE)
                .extracting(event -> event.getStatusInfo().message())
                .contains("Switching printer language to ZPL...");
    }

    @Test
    @DisplayName("Should switch a ZPL printer to line print for a CPCL payload")
    void shouldSwitchToLinePrintForCpcl() {
        // When
        Result<Void> result = workflow.print(CPCL_LABEL, device, PrintOptions.defaults());

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(transport.getSetting(SgdConstants.KEY_LANGUAGES)).isEqualTo("line_print");
    }

    // ========== Validation Tests ==========

    @Test
    @DisplayName("Should fail validation for empty data without connecting")
    void shouldFailValidationForEmptyData() {
        // When
        Result<Void> result = workflow.print("", device, PrintOptions.defaults());

        // Then
        List<PrintEvent> events = workflow.getLastRunEvents();
        assertThat(result.getError().is(ErrorCode.EMPTY_DATA)).isTrue();
        assertThat(steps(events)).containsExactly(EPrintStep.INITIALIZING, EPrintStep.VALIDATING, EPrintStep.FAILED);
        assertThat(types(events)).containsSubsequence(EPrintEventType.ERROR_OCCURRED, EPrintEventType.STEP_CHANGED);
        assertThat(last(events).getStepInfo().step()).isEqualTo(EPrintStep.FAILED);
        assertThat(transport.getConnectedAddress()).isNull();
        assertThat(workflow.getState().isFailed()).isTrue();
    }

    @Test
    @DisplayName("Should reject undetermined data as non-recoverable")
    void shouldRejectUndeterminedData() {
        // When
        Result<Void> result = workflow.print("just some text", device, PrintOptions.defaults());

        // Then
        assertThat(result.getError().is(ErrorCode.PRINT_DATA_INVALID_FORMAT)).isTrue();
        assertThat(workflow.getState().getError().recoverability()).isEqualTo(ERecoverability.NON_RECOVERABLE);
        assertThat(workflow.getState().getError().recoveryHint()).isNotBlank();
    }

    @Test
    @DisplayName("Should print undetermined data when allowed")
    void shouldPrintUndeterminedDataWhenAllowed() {
        // When
        Result<Void> result = workflow.print("just some text", device,
                PrintOptions.defaults().withAllowUndeterminedLanguage(true));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(transport.getReceivedText()).containsExactly("just some text");
    }

    @Test
    @DisplayName("Should reject oversized data")
    void shouldRejectOversizedData() {
        // Given
        PrintOptions base = PrintOptions.defaults();
        PrintOptions small = new PrintOptions(base.maxAttempts(), base.retryDelayMs(), base.maxRetryDelayMs(),
                base.checkStatus(), base.autoCorrect(), base.readinessOptions(), base.waitForCompletion(),
                base.maxWaitMs(), 10, false, false);

        // When
        Result<Void> result = workflow.print(ZPL_LABEL, device, small);

        // Then
        assertThat(result.getError().is(ErrorCode.PRINT_DATA_TOO_LARGE)).isTrue();
    }

    // ========== Retry Tests ==========

    @Test
    @DisplayName("Should retry blocking issues and fail once attempts run out")
    void shouldRetryBlockingIssuesUntilExhausted() {
        // Given
        transport.setSetting(SgdConstants.KEY_HEAD_LATCH, "open");
        PrintOptions options = PrintOptions.defaults().withMaxAttempts(2);

        // When
        Result<Void> result = workflow.print(ZPL_LABEL, device, options);

        // Then
        List<PrintEvent> events = workflow.getLastRunEvents();
        assertThat(result.getError().is(ErrorCode.BLOCKING_ISSUES)).isTrue();
        assertThat(result.getError().getMessage()).contains("Head Open");
        assertThat(events).filteredOn(event -> event.getType() == EPrintEventType.ERROR_OCCURRED).hasSize(2)
                .allSatisfy(event -> assertThat(event.getErrorInfo().recoverability())
                        .isEqualTo(ERecoverability.POSSIBLY_RECOVERABLE));
        assertThat(events).filteredOn(event -> event.getType() == EPrintEventType.RETRY_ATTEMPT)
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.getRetryInfo().attempt()).isEqualTo(2);
                    assertThat(event.getRetryInfo().maxAttempts()).isEqualTo(2);
                    assertThat(event.getRetryInfo().delayMs()).isEqualTo(PrintOptions.DEFAULT_RETRY_DELAY_MS);
                });
        assertThat(last(events).getType()).isEqualTo(EPrintEventType.STEP_CHANGED);
        assertThat(last(events).getStepInfo().step()).isEqualTo(EPrintStep.FAILED);
        assertThat(transport.getReceivedText()).doesNotContain(ZPL_LABEL);
        assertThat(sleeper.getTotalDelay()).isEqualTo(PrintOptions.DEFAULT_RETRY_DELAY_MS);
    }

    @Test
    @DisplayName("Should succeed on a later attempt once the issue clears")
    void shouldSucceedOnLaterAttempt() {
        // Given
        transport.setSetting(SgdConstants.KEY_HEAD_LATCH, "open");
        sleeper.onSleep(() -> transport.setSetting(SgdConstants.KEY_HEAD_LATCH, "ok"));

        // When
        Result<Void> result = workflow.print(ZPL_LABEL, device, PrintOptions.defaults().withWaitForCompletion(false));

        // Then
        List<PrintEvent> events = workflow.getLastRunEvents();
        assertThat(result.isSuccess()).isTrue();
        assertThat(types(events)).contains(EPrintEventType.RETRY_ATTEMPT);
        assertThat(steps(events)).containsSubsequence(EPrintStep.CHECKING_STATUS, EPrintStep.CONNECTING,
                EPrintStep.CHECKING_STATUS, EPrintStep.SENDING, EPrintStep.COMPLETED);
        assertThat(transport.getReceivedText()).containsExactly(ZPL_LABEL);
    }

    @Test
    @DisplayName("Should retry connection failures with linear backoff")
    void shouldRetryConnectionFailures() {
        // Given
        IPrinterTransport unreachable = mock(IPrinterTransport.class);
        when(unreachable.isConnected()).thenReturn(Result.success(false));
        when(unreachable.connect(anyString())).thenReturn(Result.failure(ErrorCode.CONNECTION_ERROR));
        PrintWorkflow unreachableWorkflow = createWorkflow(unreachable);

        // When
        Result<Void> result = unreachableWorkflow.print(ZPL_LABEL, device, PrintOptions.defaults());

        // Then
        assertThat(result.getError().is(ErrorCode.CONNECTION_ERROR)).isTrue();
        verify(unreachable, times(3)).connect(device.address());
        assertThat(sleeper.getTotalDelay()).isEqualTo(2000 + 4000);
        assertThat(unreachableWorkflow.getState().getError().recoverability()).isEqualTo(ERecoverability.RECOVERABLE);
    }

    @Test
    @DisplayName("Should unpause a paused printer and print")
    void shouldUnpauseAndPrint() {
        // Given
        transport.setSetting(SgdConstants.KEY_DEVICE_PAUSE, "1");

        // When
        Result<Void> result = workflow.print(ZPL_LABEL, device, PrintOptions.defaults().withWaitForCompletion(false));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(transport.getSetting(SgdConstants.KEY_DEVICE_PAUSE)).isEqualTo("false");
        assertThat(types(workflow.getLastRunEvents())).doesNotContain(EPrintEventType.RETRY_ATTEMPT);
    }

    @Test
    @DisplayName("Should send without status check when disabled")
    void shouldSendWithoutStatusCheck() {
        // Given
        transport.setSetting(SgdConstants.KEY_HEAD_LATCH, "open");

        // When
        Result<Void> result = workflow.print(ZPL_LABEL, device,
                PrintOptions.defaults().withCheckStatus(false).withWaitForCompletion(false));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(transport.getQueryCount()).isZero();
    }

    // ========== Cancellation Tests ==========

    @Test
    @DisplayName("Should emit exactly one cancelled event when cancelled while waiting")
    void shouldCancelWhileWaiting() {
        // Given
        AtomicInteger sleeps = new AtomicInteger();
        sleeper.onSleep(() -> {
            if (sleeps.incrementAndGet() == 3) {
                workflow.cancel();
            }
        });

        // When
        Result<Void> result = workflow.print(ZPL_LABEL, device, PrintOptions.defaults());

        // Then
        List<PrintEvent> events = workflow.getLastRunEvents();
        assertThat(result.getError().is(ErrorCode.OPERATION_CANCELLED)).isTrue();
        assertThat(events).filteredOn(event -> event.getType() == EPrintEventType.CANCELLED).hasSize(1);
        assertThat(last(events).getType()).isEqualTo(EPrintEventType.CANCELLED);
        assertThat(types(events)).doesNotContain(EPrintEventType.COMPLETED);
        assertThat(steps(events)).endsWith(EPrintStep.WAITING_FOR_COMPLETION, EPrintStep.CANCELLED);
        assertThat(sleeper.getDelays()).hasSize(3);
        assertThat(workflow.getState().isCancelled()).isTrue();
        assertThat(workflow.getState().getProgress())
                .isEqualTo(EPrintStep.WAITING_FOR_COMPLETION.getProgress());
    }

    @Test
    @DisplayName("Should cancel during the retry delay without another attempt")
    void shouldCancelDuringRetryDelay() {
        // Given
        transport.setSetting(SgdConstants.KEY_HEAD_LATCH, "open");
        sleeper.onSleep(workflow::cancel);

        // When
        Result<Void> result = workflow.print(ZPL_LABEL, device, PrintOptions.defaults());

        // Then
        List<PrintEvent> events = workflow.getLastRunEvents();
        assertThat(result.getError().is(ErrorCode.OPERATION_CANCELLED)).isTrue();
        assertThat(steps(events)).filteredOn(step -> step == EPrintStep.CONNECTING).hasSize(1);
        assertThat(last(events).getType()).isEqualTo(EPrintEventType.CANCELLED);
    }

    @Test
    @DisplayName("Should start a new run with a fresh cancellation token")
    void shouldStartFreshAfterCancel() {
        // Given
        workflow.cancel();

        // When
        Result<Void> result = workflow.print(ZPL_LABEL, device, PrintOptions.defaults().withWaitForCompletion(false));

        // Then
        assertThat(result.isSuccess()).isTrue();
    }

    // ========== Concurrency Tests ==========

    @Test
    @DisplayName("Should reject a second job while one is running")
    void shouldRejectConcurrentJob() {
        // Given
        AtomicReference<Result<Void>> concurrent = new AtomicReference<>();
        sleeper.onSleep(() -> {
            if (concurrent.get() == null) {
                concurrent.set(CompletableFuture.supplyAsync(
                        () -> workflow.print(ZPL_LABEL, device, PrintOptions.defaults())).join());
            }
        });

        // When
        Result<Void> result = workflow.print(ZPL_LABEL, device, PrintOptions.defaults());

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(concurrent.get().getError().is(ErrorCode.OPERATION_ERROR)).isTrue();
        assertThat(transport.getReceivedText()).containsExactly(ZPL_LABEL);
    }

    // ========== Batch Tests ==========

    @Test
    @DisplayName("Should continue a batch past failed jobs when configured")
    void shouldContinueBatchPastFailures() {
        // Given
        BatchPrintOptions options = new BatchPrintOptions(
                PrintOptions.defaults().withWaitForCompletion(false), 250, false);

        // When
        Result<Integer> result = workflow.printBatch(List.of(ZPL_LABEL, "", ZPL_LABEL), device, options);

        // Then
        assertThat(result.getData()).isEqualTo(2);
        assertThat(transport.getReceivedText()).containsExactly(ZPL_LABEL, ZPL_LABEL);
        assertThat(sleeper.getDelays()).containsExactly(250L, 250L);
    }

    @Test
    @DisplayName("Should stop a batch at the first failure when configured")
    void shouldStopBatchAtFirstFailure() {
        // Given
        BatchPrintOptions options = new BatchPrintOptions(
                PrintOptions.defaults().withWaitForCompletion(false), 0, true);

        // When
        Result<Integer> result = workflow.printBatch(List.of("", ZPL_LABEL), device, options);

        // Then
        assertThat(result.getError().is(ErrorCode.EMPTY_DATA)).isTrue();
        assertThat(transport.getReceived()).isEmpty();
    }

    @Test
    @DisplayName("Should disconnect the transport")
    void shouldDisconnect() {
        // Given
        workflow.print(ZPL_LABEL, device, PrintOptions.defaults().withWaitForCompletion(false));

        // When
        Result<Void> result = workflow.disconnect();

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(transport.isConnected().getData()).isFalse();
    }

    @Test
    @DisplayName("Should use default readiness checks when none are given")
    void shouldDefaultReadinessOptions() {
        PrintOptions options = PrintOptions.defaults().withReadinessOptions(null);

        assertThat(options.readinessOptions()).isEqualTo(ReadinessOptions.forPrinting());
    }
}
