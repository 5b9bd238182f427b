package eti.dal;

import eti.common.EConnectionType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for ConfigurationLoader
 */
class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("printer.name");
        System.clearProperty("printer.network.port");
        System.clearProperty("workflow.wait.for.completion");
        System.clearProperty("workflow.max.wait");
        System.clearProperty("printer.connection.type");
    }

    @Test
    @DisplayName("Should load configuration from properties file")
    void shouldLoadFromPropertiesFile() throws IOException {
        // Given
        Path configFile = tempDir.resolve("test.properties");
        Properties props = new Properties();
        props.setProperty("printer.name", "ZQ521 Dock");
        props.setProperty("printer.ip", "10.1.2.3");

        try (var writer = Files.newBufferedWriter(configFile)) {
            props.store(writer, "Test config");
        }

        ConfigurationLoader loader = new ConfigurationLoader(configFile.toString());

        // When
        String printerName = loader.getString("printer.name", "default");
        String printerIp = loader.getString("printer.ip", "default");

        // Then
        assertThat(printerName).isEqualTo("ZQ521 Dock");
        assertThat(printerIp).isEqualTo("10.1.2.3");
    }

    @Test
    @DisplayName("Should fall back to classpath defaults for keys missing from the file")
    void shouldFallBackToClasspathDefaults() throws IOException {
        // Given
        Path configFile = tempDir.resolve("partial.properties");
        Files.writeString(configFile, "printer.name=Partial\n");

        // When
        ConfigurationLoader loader = new ConfigurationLoader(configFile.toString());

        // Then
        assertThat(loader.getString("printer.name", "default")).isEqualTo("Partial");
        assertThat(loader.getInt("workflow.max.attempts", 0)).isEqualTo(3);
    }

    @Test
    @DisplayName("Should prioritize system properties over file")
    void shouldPrioritizeSystemProperties() {
        // Given
        System.setProperty("printer.name", "SystemPrinter");
        ConfigurationLoader loader = new ConfigurationLoader();

        // When
        String printerName = loader.getString("printer.name", "default");

        // Then
        assertThat(printerName).isEqualTo("SystemPrinter");
    }

    @Test
    @DisplayName("Should use default value when property not found")
    void shouldUseDefaultValue() {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader();

        // When
        String value = loader.getString("nonexistent.property", "defaultValue");

        // Then
        assertThat(value).isEqualTo("defaultValue");
    }

    @Test
    @DisplayName("Should parse numeric values and fall back on invalid ones")
    void shouldParseNumericValues() {
        // Given
        System.setProperty("printer.network.port", "6101");
        System.setProperty("workflow.max.wait", "soon");
        ConfigurationLoader loader = new ConfigurationLoader();

        // Then
        assertThat(loader.getInt("printer.network.port", 9100)).isEqualTo(6101);
        assertThat(loader.getLong("workflow.max.wait", 60000L)).isEqualTo(60000L);
    }

    @Test
    @DisplayName("Should parse boolean values correctly")
    void shouldParseBooleanValues() {
        // Given
        System.setProperty("workflow.wait.for.completion", "false");
        ConfigurationLoader loader = new ConfigurationLoader();

        // When
        boolean wait = loader.getBoolean("workflow.wait.for.completion", true);

        // Then
        assertThat(wait).isFalse();
    }

    @Test
    @DisplayName("Should parse enums case-insensitively and default on unknown values")
    void shouldParseEnums() {
        ConfigurationLoader loader = new ConfigurationLoader();

        System.setProperty("printer.connection.type", "network");
        assertThat(loader.getEnum("printer.connection.type", EConnectionType.class, EConnectionType.NONE))
                .isEqualTo(EConnectionType.NETWORK);

        System.setProperty("printer.connection.type", "SERIAL");
        assertThat(loader.getEnum("printer.connection.type", EConnectionType.class, EConnectionType.NONE))
                .isEqualTo(EConnectionType.NONE);
    }
}
