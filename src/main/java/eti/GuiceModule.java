package eti;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import eti.dal.ConfigurationService;
import eti.dal.PrinterConfig;
import eti.dal.SelectorConfig;
import eti.dal.WorkflowConfig;
import eti.domain.discovery.IConnectionHistoryStore;
import eti.domain.discovery.InMemoryConnectionHistoryStore;
import eti.domain.discovery.JsonFileConnectionHistoryStore;
import eti.domain.discovery.SmartDeviceSelector;
import eti.domain.policy.TimeoutPolicy;
import eti.domain.transport.DummyPrinterTransport;
import eti.domain.transport.IPrinterTransport;
import eti.domain.transport.TcpPrinterTransport;

import java.nio.file.Paths;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * @since 17/10/2026
 */
public class GuiceModule extends AbstractModule {
    private static final int WORKER_THREADS = 4;

    private final ConfigurationService configService;

    public GuiceModule(ConfigurationService configService) {
        this.configService = configService;
    }

    @Override
    protected void configure() {
        bind(PrinterConfig.class).toInstance(configService.getPrinterConfiguration());
        bind(WorkflowConfig.class).toInstance(configService.getWorkflowConfiguration());
        bind(SelectorConfig.class).toInstance(configService.getSelectorConfiguration());
    }

    @Provides
    @Singleton
    IPrinterTransport provideTransport(PrinterConfig config) {
        return switch (config.connectionType()) {
            case NETWORK -> new TcpPrinterTransport(config);
            case NONE -> new DummyPrinterTransport();
        };
    }

    @Provides
    @Singleton
    TimeoutPolicy provideTimeoutPolicy() {
        return new TimeoutPolicy();
    }

    @Provides
    @Singleton
    ExecutorService provideExecutor() {
        return Executors.newFixedThreadPool(WORKER_THREADS, new ThreadFactoryBuilder()
                .setNameFormat("etiketa-worker-%d")
                .setDaemon(true)
                .build());
    }

    @Provides
    @Singleton
    IConnectionHistoryStore provideHistoryStore(SelectorConfig config) {
        if (config.isHistoryPersistent()) {
            return new JsonFileConnectionHistoryStore(Paths.get(config.historyFile()));
        }
        return new InMemoryConnectionHistoryStore();
    }

    @Provides
    @Singleton
    SmartDeviceSelector provideSelector(IConnectionHistoryStore historyStore, SelectorConfig config) {
        return new SmartDeviceSelector(historyStore, config.preferredTransport());
    }
}
