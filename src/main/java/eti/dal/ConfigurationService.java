package eti.dal;

import eti.common.EConnectionType;
import eti.common.ETransportType;
import eti.common.SgdConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main configuration service - entry point for all configuration needs
 * @since 14/10/2026
 */
public class ConfigurationService {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationService.class);

    private final ConfigurationLoader loader;
    private final PrinterConfig printerConfig;
    private final WorkflowConfig workflowConfig;
    private final SelectorConfig selectorConfig;

    public ConfigurationService() throws ConfigurationException {
        this(new ConfigurationLoader());
    }

    public ConfigurationService(ConfigurationLoader loader) throws ConfigurationException {
        this.loader = loader;
        this.printerConfig = loadPrinterConfiguration();
        this.workflowConfig = loadWorkflowConfiguration();
        this.selectorConfig = loadSelectorConfiguration();
    }

    private PrinterConfig loadPrinterConfiguration() throws ConfigurationException {
        String name = loader.getString("printer.name", "ZQ520");
        EConnectionType connectionType = loader.getEnum("printer.connection.type", EConnectionType.class,
                EConnectionType.NONE);

        PrinterConfig config = switch (connectionType) {
            case NETWORK -> {
                String ip = loader.getString("printer.ip", "192.168.1.50");
                int port = loader.getInt("printer.network.port", SgdConstants.DEFAULT_PORT);
                int timeout = loader.getInt("printer.connection.timeout", SgdConstants.DEFAULT_CONNECTION_TIMEOUT);
                int readTimeout = loader.getInt("printer.read.timeout", SgdConstants.DEFAULT_READ_TIMEOUT);
                logger.info("Configured NETWORK printer: {} at {}:{}", name, ip, port);
                yield PrinterConfig.network(name, ip, port, timeout, readTimeout);
            }
            case NONE -> {
                logger.info("Configured DUMMY printer: {}", name);
                yield PrinterConfig.dummy(name);
            }
        };

        config.validate();
        return config;
    }

    private WorkflowConfig loadWorkflowConfiguration() throws ConfigurationException {
        WorkflowConfig defaults = WorkflowConfig.defaults();
        WorkflowConfig config = new WorkflowConfig(
                loader.getInt("workflow.max.attempts", defaults.maxAttempts()),
                loader.getLong("workflow.retry.delay", defaults.retryDelayMs()),
                loader.getLong("workflow.retry.max.delay", defaults.maxRetryDelayMs()),
                loader.getLong("workflow.command.timeout", defaults.commandTimeoutMs()),
                loader.getLong("workflow.max.wait", defaults.maxWaitMs()),
                loader.getInt("workflow.max.data.size", defaults.maxDataSize()),
                loader.getBoolean("workflow.wait.for.completion", defaults.waitForCompletion()),
                loader.getBoolean("workflow.auto.correct", defaults.autoCorrect()));
        config.validate();
        return config;
    }

    private SelectorConfig loadSelectorConfiguration() throws ConfigurationException {
        boolean preferNetwork = loader.getBoolean("discovery.prefer.network", true);
        String historyFile = loader.getString("discovery.history.file", null);
        SelectorConfig config = new SelectorConfig(
                preferNetwork ? ETransportType.NETWORK : ETransportType.BLUETOOTH, historyFile);
        config.validate();
        return config;
    }

    public PrinterConfig getPrinterConfiguration() {
        return printerConfig;
    }

    public WorkflowConfig getWorkflowConfiguration() {
        return workflowConfig;
    }

    public SelectorConfig getSelectorConfiguration() {
        return selectorConfig;
    }
}
