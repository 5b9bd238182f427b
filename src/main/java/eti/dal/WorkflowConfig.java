package eti.dal;

import eti.common.SgdConstants;

/**
 * Print workflow defaults
 * @since 14/10/2026
 */
public record WorkflowConfig(
        int maxAttempts,
        long retryDelayMs,
        long maxRetryDelayMs,
        long commandTimeoutMs,
        long maxWaitMs,
        int maxDataSize,
        boolean waitForCompletion,
        boolean autoCorrect) {

    public static WorkflowConfig defaults() {
        return new WorkflowConfig(3, 2000, 30000, SgdConstants.DEFAULT_COMMAND_TIMEOUT, 60000,
                SgdConstants.MAX_DATA_SIZE, true, true);
    }

    public void validate() throws ConfigurationException {
        if (maxAttempts < 1 || maxAttempts > 10) {
            throw new ConfigurationException("Workflow max attempts must be between 1 and 10");
        }
        if (retryDelayMs < 0 || maxRetryDelayMs < 0) {
            throw new ConfigurationException("Retry delays cannot be negative");
        }
        if (commandTimeoutMs < 100) {
            throw new ConfigurationException("Command timeout must be at least 100ms");
        }
        if (maxWaitMs < 0) {
            throw new ConfigurationException("Max wait cannot be negative");
        }
        if (maxDataSize < 1) {
            throw new ConfigurationException("Max data size must be positive");
        }
    }
}
