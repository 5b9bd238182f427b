package eti.dal;

import eti.common.EConnectionType;
import eti.common.ETransportType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for ConfigurationService
 */
class ConfigurationServiceTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("printer.name");
        System.clearProperty("printer.connection.type");
        System.clearProperty("printer.ip");
        System.clearProperty("printer.network.port");
        System.clearProperty("printer.connection.timeout");
        System.clearProperty("workflow.max.attempts");
        System.clearProperty("workflow.command.timeout");
        System.clearProperty("discovery.prefer.network");
        System.clearProperty("discovery.history.file");
    }

    @Test
    @DisplayName("Should default to a dummy printer")
    void shouldDefaultToDummyPrinter() throws ConfigurationException {
        // When
        ConfigurationService service = new ConfigurationService();

        // Then
        PrinterConfig config = service.getPrinterConfiguration();
        assertThat(config.isDummy()).isTrue();
        assertThat(config.name()).isEqualTo("ZQ520");
        assertThat(service.getWorkflowConfiguration()).isEqualTo(WorkflowConfig.defaults());
        assertThat(service.getSelectorConfiguration().preferredTransport()).isEqualTo(ETransportType.NETWORK);
        assertThat(service.getSelectorConfiguration().isHistoryPersistent()).isFalse();
    }

    @Test
    @DisplayName("Should load valid network printer configuration")
    void shouldLoadNetworkPrinterConfiguration() throws ConfigurationException {
        // Given
        System.setProperty("printer.connection.type", "NETWORK");
        System.setProperty("printer.name", "RW420");
        System.setProperty("printer.ip", "10.0.0.150");
        System.setProperty("printer.network.port", "6101");
        System.setProperty("printer.connection.timeout", "10000");

        // When
        PrinterConfig config = new ConfigurationService().getPrinterConfiguration();

        // Then
        assertThat(config.connectionType()).isEqualTo(EConnectionType.NETWORK);
        assertThat(config.name()).isEqualTo("RW420");
        assertThat(config.getAddress()).isEqualTo("10.0.0.150:6101");
        assertThat(config.connectionTimeout()).isEqualTo(10000);
    }

    @Test
    @DisplayName("Should throw exception for invalid printer port")
    void shouldThrowForInvalidPort() {
        // Given
        System.setProperty("printer.connection.type", "NETWORK");
        System.setProperty("printer.network.port", "99999");

        // When & Then
        assertThatThrownBy(ConfigurationService::new)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("port must be between 1 and 65535");
    }

    @Test
    @DisplayName("Should throw exception for out of range workflow attempts")
    void shouldThrowForInvalidAttempts() {
        // Given
        System.setProperty("workflow.max.attempts", "0");

        // When & Then
        assertThatThrownBy(ConfigurationService::new)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("max attempts");
    }

    @Test
    @DisplayName("Should throw exception for too short command timeout")
    void shouldThrowForShortCommandTimeout() {
        // Given
        System.setProperty("workflow.command.timeout", "50");

        // When & Then
        assertThatThrownBy(ConfigurationService::new)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Command timeout");
    }

    @Test
    @DisplayName("Should load selector preferences")
    void shouldLoadSelectorPreferences() throws ConfigurationException {
        // Given
        System.setProperty("discovery.prefer.network", "false");
        System.setProperty("discovery.history.file", "data/history.json");

        // When
        SelectorConfig config = new ConfigurationService().getSelectorConfiguration();

        // Then
        assertThat(config.preferredTransport()).isEqualTo(ETransportType.BLUETOOTH);
        assertThat(config.isHistoryPersistent()).isTrue();
    }
}
