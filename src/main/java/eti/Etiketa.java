package eti;

import com.google.inject.Guice;
import com.google.inject.Injector;
import eti.common.ETransportType;
import eti.dal.ConfigurationException;
import eti.dal.ConfigurationService;
import eti.dal.PrinterConfig;
import eti.dal.WorkflowConfig;
import eti.domain.Result;
import eti.domain.discovery.PrinterDevice;
import eti.domain.discovery.SmartDeviceSelector;
import eti.domain.discovery.SmartDiscoveryResult;
import eti.domain.print.PrintEvent;
import eti.domain.print.PrintOptions;
import eti.domain.print.PrintWorkflow;
import io.reactivex.rxjava3.disposables.Disposable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command line entry point: prints a label file to the configured printer.
 * <pre>java -jar etiketa.jar &lt;label-file&gt;</pre>
 *
 * @since 17/10/2026
 */
public class Etiketa {
    private static final Logger logger = LoggerFactory.getLogger(Etiketa.class);

    public static void main(String[] args) {
        if (args.length < 1) {
            logger.error("Usage: etiketa <label-file>");
            System.exit(2);
        }
        logger.info("Starting Etiketa...");

        try {
            ConfigurationService configService = new ConfigurationService();
            PrinterConfig printerConfig = configService.getPrinterConfiguration();
            WorkflowConfig workflowConfig = configService.getWorkflowConfiguration();
            logger.debug("Printer: {}", printerConfig);
            logger.debug("Workflow: {}", workflowConfig);

            Injector injector = Guice.createInjector(new GuiceModule(configService));

            String data = Files.readString(Paths.get(args[0]), StandardCharsets.UTF_8);
            PrinterDevice device = selectDevice(injector.getInstance(SmartDeviceSelector.class), printerConfig);

            PrintWorkflow workflow = injector.getInstance(PrintWorkflow.class);
            Disposable subscription = workflow.getEvents().subscribe(Etiketa::logEvent);
            Result<Void> result = workflow.print(data, device, PrintOptions.fromConfig(workflowConfig));
            subscription.dispose();
            workflow.disconnect();

            if (result.isFailure()) {
                logger.error("Printing failed: {} ({})", result.getError().getMessage(), result.getError().getRecoveryHint());
                System.exit(1);
            }
            logger.info("Label printed successfully");

        } catch (ConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);

        } catch (IOException e) {
            logger.error("Cannot read label file '{}': {}", args[0], e.getMessage());
            System.exit(1);
        }
    }

    private static PrinterDevice selectDevice(SmartDeviceSelector selector, PrinterConfig config) {
        PrinterDevice configured = new PrinterDevice(config.getAddress(), config.name(),
                ETransportType.NETWORK, false, "Configured");
        SmartDiscoveryResult selection = selector.select(List.of(configured));
        return selection.getSelected().orElse(configured);
    }

    private static void logEvent(PrintEvent event) {
        switch (event.getType()) {
            case STEP_CHANGED -> logger.info("[{}%] {}",
                    Math.round(event.getStepInfo().progress() * 100), event.getStepInfo().message());
            case STATUS_UPDATE -> logger.info("Status: {} {}",
                    event.getStatusInfo().message(), event.getStatusInfo().issues());
            case RETRY_ATTEMPT -> logger.warn("Retrying (attempt {}/{}) in {}ms",
                    event.getRetryInfo().attempt(), event.getRetryInfo().maxAttempts(), event.getRetryInfo().delayMs());
            case ERROR_OCCURRED -> logger.warn("Error: {} - {}",
                    event.getErrorInfo().message(), event.getErrorInfo().recoveryHint());
            case PROGRESS_UPDATE -> logger.debug("Progress {}", event.getProgressInfo().progress());
            case COMPLETED, CANCELLED -> logger.info("Print {}", event.getType());
        }
    }
}
