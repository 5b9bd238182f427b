package eti.dal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;

/**
 * Resolves configuration values with priority:
 * 1. System Properties
 * 2. Environment Variables (dots to underscores, upper case)
 * 3. External application.properties (explicit file, -Dconfig.dir, or ./config)
 * 4. Classpath application.properties
 *
 * @since 14/10/2026
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);
    private static final String CONFIG_FILE_NAME = "application.properties";
    private static final String EXTERNAL_CONFIG_DIR = "config";

    private final Properties properties;

    public ConfigurationLoader() {
        this.properties = new Properties();
        properties.putAll(loadFromClasspath());
        properties.putAll(loadExternal(resolveExternalFile()));
    }

    /**
     * Use an explicit file on top of the classpath defaults
     */
    public ConfigurationLoader(String configFile) {
        this.properties = new Properties();
        properties.putAll(loadFromClasspath());
        properties.putAll(loadExternal(Paths.get(configFile)));
    }

    private Path resolveExternalFile() {
        String configDir = System.getProperty("config.dir");
        if (configDir == null) {
            configDir = System.getenv("CONFIG_DIR");
        }
        if (configDir != null) {
            return Paths.get(configDir, CONFIG_FILE_NAME).normalize();
        }
        return Paths.get(EXTERNAL_CONFIG_DIR, CONFIG_FILE_NAME);
    }

    private Properties loadExternal(Path path) {
        Properties props = new Properties();
        if (!Files.isRegularFile(path)) {
            logger.debug("External config not found at: {}", path.toAbsolutePath());
            return props;
        }
        try (InputStream input = Files.newInputStream(path)) {
            props.load(input);
            logger.info("Loaded external configuration from: {}", path.toAbsolutePath());
        } catch (IOException e) {
            logger.warn("Failed to load external config from '{}': {}", path, e.getMessage());
        }
        return props;
    }

    private Properties loadFromClasspath() {
        Properties props = new Properties();
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE_NAME)) {
            if (input != null) {
                props.load(input);
                logger.debug("Loaded classpath configuration '{}'", CONFIG_FILE_NAME);
            } else {
                logger.warn("No classpath configuration found, using built-in defaults only");
            }
        } catch (IOException e) {
            logger.warn("Error loading classpath configuration: {}", e.getMessage());
        }
        return props;
    }

    /**
     * Get string property with priority: System Property > Env Var > Properties File > Default
     */
    public String getString(String key, String defaultValue) {
        String value = System.getProperty(key);
        if (value != null) {
            logger.debug("Property '{}' from System Properties: {}", key, value);
            return value;
        }

        String envKey = key.replace('.', '_').toUpperCase(Locale.ROOT);
        value = System.getenv(envKey);
        if (value != null) {
            logger.debug("Property '{}' from Environment Variable '{}': {}", key, envKey, value);
            return value;
        }

        value = properties.getProperty(key);
        if (value != null) {
            return value;
        }

        logger.debug("Property '{}' not found, using default: {}", key, defaultValue);
        return defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for property '{}': '{}', using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for property '{}': '{}', using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Enum property; an unknown value logs a warning and yields the default
     */
    public <E extends Enum<E>> E getEnum(String key, Class<E> type, E defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid {} '{}' for property '{}', defaulting to {}",
                    type.getSimpleName(), value, key, defaultValue);
            return defaultValue;
        }
    }
}
