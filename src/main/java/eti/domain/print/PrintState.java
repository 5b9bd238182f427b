package eti.domain.print;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Immutable workflow snapshot; every change produces a new instance
 * @since 16/10/2026
 */
public final class PrintState {
    private final EPrintStep step;
    private final boolean running;
    private final boolean completed;
    private final boolean cancelled;
    private final int attempt;
    private final int maxAttempts;
    private final double progress;
    private final List<String> issues;
    private final PrintErrorInfo error;

    public PrintState(EPrintStep step, boolean running, boolean completed, boolean cancelled,
                      int attempt, int maxAttempts, double progress, List<String> issues, PrintErrorInfo error) {
        this.step = step;
        this.running = running;
        this.completed = completed;
        this.cancelled = cancelled;
        this.attempt = attempt;
        this.maxAttempts = maxAttempts;
        this.progress = progress;
        this.issues = issues != null ? ImmutableList.copyOf(issues) : ImmutableList.of();
        this.error = error;
    }

    public static PrintState idle() {
        return new PrintState(EPrintStep.INITIALIZING, false, false, false, 0, 0, 0.0, null, null);
    }

    public static PrintState started(int maxAttempts) {
        return new PrintState(EPrintStep.INITIALIZING, true, false, false, 0, maxAttempts, 0.0, null, null);
    }

    /**
     * Move to a step. Terminal steps stop the run; failed and cancelled keep the progress.
     */
    public PrintState withStep(EPrintStep newStep) {
        double newProgress = newStep.getProgress() >= 0 ? newStep.getProgress() : progress;
        return new PrintState(newStep, !newStep.isTerminal(), newStep == EPrintStep.COMPLETED,
                newStep == EPrintStep.CANCELLED, attempt, maxAttempts, newProgress, issues, error);
    }

    public PrintState withAttempt(int newAttempt) {
        return new PrintState(step, running, completed, cancelled, newAttempt, maxAttempts, progress, issues, error);
    }

    public PrintState withProgress(double newProgress) {
        return new PrintState(step, running, completed, cancelled, attempt, maxAttempts,
                Math.max(progress, newProgress), issues, error);
    }

    public PrintState withIssues(List<String> newIssues) {
        return new PrintState(step, running, completed, cancelled, attempt, maxAttempts, progress, newIssues, error);
    }

    public PrintState withError(PrintErrorInfo newError) {
        return new PrintState(step, running, completed, cancelled, attempt, maxAttempts, progress, issues, newError);
    }

    public EPrintStep getStep() {
        return step;
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isCompleted() {
        return completed;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isFailed() {
        return step == EPrintStep.FAILED;
    }

    public int getAttempt() {
        return attempt;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public double getProgress() {
        return progress;
    }

    public List<String> getIssues() {
        return issues;
    }

    public PrintErrorInfo getError() {
        return error;
    }

    @Override
    public String toString() {
        return String.format("PrintState{step=%s, attempt=%d/%d, progress=%.2f, issues=%s}",
                step, attempt, maxAttempts, progress, issues);
    }
}
