package eti;

import com.google.inject.Guice;
import com.google.inject.Injector;
import eti.dal.ConfigurationException;
import eti.dal.ConfigurationService;
import eti.domain.discovery.IConnectionHistoryStore;
import eti.domain.discovery.InMemoryConnectionHistoryStore;
import eti.domain.discovery.PrinterDevice;
import eti.domain.print.PrintOptions;
import eti.domain.print.PrintWorkflow;
import eti.domain.transport.DummyPrinterTransport;
import eti.domain.transport.IPrinterTransport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for GuiceModule wiring with the default configuration
 */
class GuiceModuleTest {

    @Test
    @DisplayName("Should wire a dummy transport and singleton workflow by default")
    void shouldWireDefaults() throws ConfigurationException {
        // Given
        Injector injector = Guice.createInjector(new GuiceModule(new ConfigurationService()));

        // When
        IPrinterTransport transport = injector.getInstance(IPrinterTransport.class);
        PrintWorkflow workflow = injector.getInstance(PrintWorkflow.class);

        // Then
        assertThat(transport).isInstanceOf(DummyPrinterTransport.class);
        assertThat(injector.getInstance(PrintWorkflow.class)).isSameAs(workflow);
        assertThat(injector.getInstance(IConnectionHistoryStore.class)).isInstanceOf(InMemoryConnectionHistoryStore.class);
    }

    @Test
    @DisplayName("Should print through the wired workflow")
    void shouldPrintThroughWiredWorkflow() throws ConfigurationException {
        // Given
        Injector injector = Guice.createInjector(new GuiceModule(new ConfigurationService()));
        PrintWorkflow workflow = injector.getInstance(PrintWorkflow.class);
        DummyPrinterTransport transport = (DummyPrinterTransport) injector.getInstance(IPrinterTransport.class);

        // When
        var result = workflow.print("^XA^FDwired^FS^XZ", PrinterDevice.network("dummy:9100", "ZQ520"),
                PrintOptions.defaults().withWaitForCompletion(false));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(transport.getReceivedText()).containsExactly("^XA^FDwired^FS^XZ");
    }
}
