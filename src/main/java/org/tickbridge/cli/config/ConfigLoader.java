package org.tickbridge.cli.config;

import java.io.File;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the HOCON configuration for the command line entry points.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Java system properties ({@code -Dtickbridge.host.tickIntervalMs=50})</li>
 *   <li>Environment variables</li>
 *   <li>The user configuration file, if one is found</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * The file is looked up in this order: the {@code --config} option, the {@code -Dconfig.file}
 * property, then {@code config/tickbridge.conf} in the working directory.
 */
public final class ConfigLoader {

    static final String DEFAULT_CONFIG_FILE = "config/tickbridge.conf";

    private ConfigLoader() {
    }

    /**
     * Receives progress messages while the configuration file is being located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(boolean warning, String message);
    }

    /**
     * @param explicitConfigFile file given on the command line, or null
     * @param handler            receives which file was chosen
     * @return the resolved configuration
     * @throws IllegalArgumentException            if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException if the file cannot be parsed or resolved
     */
    public static Config resolve(File explicitConfigFile, ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(false, "Using configuration file " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: " + systemConfigFile.getAbsolutePath());
            }
            handler.log(false, "Using configuration file from -Dconfig.file: " + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        File workingDirConfig = new File(DEFAULT_CONFIG_FILE);
        if (workingDirConfig.exists()) {
            handler.log(false, "Using configuration file " + workingDirConfig.getAbsolutePath());
            return loadFromFile(workingDirConfig);
        }

        handler.log(true, "No '" + DEFAULT_CONFIG_FILE + "' found, using defaults from classpath");
        return loadDefaults();
    }

    static Config loadFromFile(File configFile) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.parseFile(configFile))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }
}
