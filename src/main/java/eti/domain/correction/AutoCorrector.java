package eti.domain.correction;

import eti.common.EPrintLanguage;
import eti.common.SgdConstants;
import eti.domain.ErrorCode;
import eti.domain.ISleeper;
import eti.domain.Result;
import eti.domain.policy.RetryPolicy;
import eti.domain.policy.RetryPolicyConfig;
import eti.domain.protocol.SgdCodec;
import eti.domain.readiness.CorrectedReadiness;
import eti.domain.readiness.CorrectionEntry;
import eti.domain.readiness.EReadinessDimension;
import eti.domain.readiness.PrinterReadiness;
import eti.domain.transport.PrinterChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Best-effort self-healing driven by a readiness snapshot.
 *
 * <p>Triggers are evaluated against cached readiness only. Each correction is independent:
 * a failing one is logged and recorded, and the remaining ones still run.
 * Dimensions touched by a successful correction are reset so the next read reflects the fix.</p>
 *
 * @since 15/10/2026
 */
public class AutoCorrector {
    private static final Logger logger = LoggerFactory.getLogger(AutoCorrector.class);

    public static final String UNPAUSE = "Unpause";
    public static final String CLEAR_ERRORS = "Clear errors";
    public static final String CALIBRATE = "Calibrate";
    public static final String CLEAR_BUFFER = "Clear buffer";

    private final PrinterChannel channel;
    private final AutoCorrectionOptions options;
    private final ISleeper sleeper;
    private final Consumer<String> statusCallback;
    private final StateChangeVerifier verifier;
    private final RetryPolicy commandRetry;

    public AutoCorrector(PrinterChannel channel, AutoCorrectionOptions options) {
        this(channel, options, ISleeper.SYSTEM, status -> { });
    }

    public AutoCorrector(PrinterChannel channel, AutoCorrectionOptions options,
                         ISleeper sleeper, Consumer<String> statusCallback) {
        this.channel = channel;
        this.options = options;
        this.sleeper = sleeper;
        this.statusCallback = statusCallback;
        this.verifier = new StateChangeVerifier(channel, options.maxAttempts(), options.attemptDelayMs(), sleeper);
        this.commandRetry = new RetryPolicy(
                new RetryPolicyConfig(options.maxAttempts(), options.attemptDelayMs(), 0, 1.0, true, true, null),
                sleeper);
    }

    public AutoCorrectionOptions getOptions() {
        return options;
    }

    /**
     * Apply every enabled correction whose trigger holds in the snapshot
     */
    public CorrectedReadiness correct(PrinterReadiness readiness) {
        List<CorrectionEntry> log = new ArrayList<>();

        if (options.enableUnpause() && Boolean.TRUE.equals(readiness.isPaused())) {
            log.add(apply(UNPAUSE, "Unpausing printer...", this::unpause,
                    readiness, EReadinessDimension.PAUSE));
        }

        if (options.enableClearErrors() && !readiness.getErrors().isEmpty()) {
            log.add(apply(CLEAR_ERRORS, "Clearing printer errors...",
                    () -> sendSettled(SgdCodec.toBytes(SgdConstants.CLEAR_ERRORS)),
                    readiness, EReadinessDimension.HOST_ERRORS));
        }

        if (options.enableCalibration() && Boolean.FALSE.equals(readiness.hasMedia())) {
            log.add(apply(CALIBRATE, "Calibrating media...",
                    () -> sendSettled(SgdCodec.toBytes(SgdConstants.CALIBRATE)),
                    readiness, EReadinessDimension.MEDIA));
        }

        if (options.enableBufferClear() && !readiness.getBlockingIssues().isEmpty()) {
            log.add(apply(CLEAR_BUFFER, "Clearing print buffer...",
                    () -> sendSettled(new byte[]{SgdConstants.CLEAR_BUFFER}),
                    readiness, null));
        }

        CorrectedReadiness result = new CorrectedReadiness(readiness, log, System.currentTimeMillis());
        if (result.hasCorrections()) {
            logger.info("Auto-correction finished: {}", result.correctionSummary());
        }
        return result;
    }

    /**
     * Make sure the printer language matches the payload. Re-reads the current language,
     * switches only on mismatch, and assumes no action is needed when either side is unknown.
     */
    public Result<Boolean> switchLanguageForData(String data, PrinterReadiness readiness) {
        EPrintLanguage required = SgdCodec.detectLanguage(data);
        if (required == EPrintLanguage.UNDETERMINED) {
            logger.debug("Payload language undetermined, skipping language check");
            return Result.success(true);
        }

        Result<String> current = channel.getSetting(SgdConstants.KEY_LANGUAGES);
        if (current.isFailure() || current.getData() == null) {
            logger.warn("Could not read printer language, assuming {} is active", required);
            return Result.success(true);
        }
        if (required.matches(current.getData())) {
            return Result.success(true);
        }

        statusCallback.accept("Switching printer language to " + required + "...");
        logger.info("Printer language '{}' does not match payload {}, switching", current.getData(), required);

        Result<Boolean> switched = verifier.setStringState(
                SgdConstants.KEY_LANGUAGES, required.getDeviceValue(), required::matches);
        if (readiness != null) {
            readiness.resetDimension(EReadinessDimension.LANGUAGE);
        }
        if (switched.isFailure()) {
            return switched;
        }
        if (!switched.getData()) {
            return Result.failure(ErrorCode.LANGUAGE_MISMATCH, required, current.getData());
        }
        statusCallback.accept("Printer language switched to " + required);
        return Result.success(true);
    }

    private Result<Void> unpause() {
        Result<Boolean> verified = verifier.setBooleanState(SgdConstants.KEY_DEVICE_PAUSE, false);
        if (verified.isFailure()) {
            return verified.propagate();
        }
        return verified.getData()
                ? Result.success()
                : Result.failure(ErrorCode.PRINTER_PAUSED);
    }

    private Result<Void> sendSettled(byte[] command) {
        Result<Void> sent = commandRetry.executeWithResult(() -> channel.sendBytes(command));
        if (sent.isSuccess()) {
            try {
                sleeper.sleep(options.attemptDelayMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return sent;
    }

    private CorrectionEntry apply(String name, String status, Supplier<Result<Void>> action,
                                  PrinterReadiness readiness, EReadinessDimension affected) {
        statusCallback.accept(status);
        Result<Void> outcome;
        try {
            outcome = action.get();
        } catch (RuntimeException e) {
            logger.error("Correction '{}' failed unexpectedly: {}", name, e.getMessage());
            return CorrectionEntry.failed(name, e.getMessage());
        }

        if (outcome.isFailure()) {
            logger.warn("Correction '{}' failed: {}", name, outcome.getError().getMessage());
            statusCallback.accept(name + " failed");
            return CorrectionEntry.failed(name, outcome.getError().getMessage());
        }

        logger.info("Correction '{}' applied", name);
        statusCallback.accept(name + " succeeded");
        if (affected != null) {
            readiness.resetDimension(affected);
        }
        return CorrectionEntry.succeeded(name);
    }
}
