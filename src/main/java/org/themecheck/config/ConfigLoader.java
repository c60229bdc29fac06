package org.themecheck.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;

/**
 * Loads the analysis configuration.
 * <p>
 * Composes HOCON configuration from multiple sources with the following precedence
 * (highest to lowest):
 * <ol>
 *   <li>Java system properties ({@code -Dkey=value})</li>
 *   <li>Environment variables</li>
 *   <li>Theme configuration file ({@code .theme-check.conf})</li>
 *   <li>Default reference configuration ({@code reference.conf} on the classpath)</li>
 * </ol>
 * Substitutions are resolved after all layers are composed, so overriding a value referenced from
 * {@code reference.conf} propagates to the values built from it.
 */
public final class ConfigLoader {

    public static final String CONFIG_FILE_NAME = ".theme-check.conf";

    /** Source reported for configurations that come from the classpath only. */
    public static final String DEFAULTS_SOURCE = "reference.conf";

    private ConfigLoader() {
    }

    /**
     * Message severity levels for configuration resolution feedback.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages during configuration file resolution.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        /**
         * @param level   the severity of the message.
         * @param message the human-readable description.
         */
        void log(MessageLevel level, String message);
    }

    /**
     * A resolved configuration and the file it was read from.
     *
     * @param config The resolved configuration.
     * @param source The configuration file path, or {@value #DEFAULTS_SOURCE} if none was used.
     */
    public record LoadedConfig(Config config, String source) {}

    /**
     * Resolves configuration using this cascade:
     * <ol>
     *   <li><strong>Explicit file:</strong> a file chosen by the caller</li>
     *   <li><strong>System property:</strong> {@code -Dconfig.file}</li>
     *   <li><strong>Theme directory:</strong> {@code .theme-check.conf} in {@code themeRoot}</li>
     *   <li><strong>Classpath defaults:</strong> {@code reference.conf} only</li>
     * </ol>
     * System properties and environment variables take precedence over the file at every level.
     *
     * @param explicitConfigFile config file chosen by the caller, or {@code null} for discovery.
     * @param themeRoot          directory searched for {@code .theme-check.conf}, or {@code null} for the
     *                           current directory.
     * @param handler            callback for resolution progress messages.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if an explicitly specified config file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static LoadedConfig resolve(final File explicitConfigFile, final File themeRoot,
                                       final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO, "Using configuration file " + explicitConfigFile.getAbsolutePath());
            return new LoadedConfig(loadFromFile(explicitConfigFile), explicitConfigFile.getPath());
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: "
                                + systemConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via -Dconfig.file: " + systemConfigFile.getAbsolutePath());
            return new LoadedConfig(loadFromFile(systemConfigFile), systemConfigPath);
        }

        final File themeConfigFile = new File(themeRoot, CONFIG_FILE_NAME);
        if (themeConfigFile.exists()) {
            handler.log(MessageLevel.INFO, "Using theme configuration file " + themeConfigFile.getAbsolutePath());
            return new LoadedConfig(loadFromFile(themeConfigFile), themeConfigFile.getPath());
        }

        handler.log(MessageLevel.WARN,
                "No '" + CONFIG_FILE_NAME + "' found. Using default configuration from classpath.");
        return new LoadedConfig(loadDefaults(), DEFAULTS_SOURCE);
    }

    /**
     * Loads configuration from a file, merged with classpath defaults.
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads configuration from classpath defaults only.
     */
    public static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}
