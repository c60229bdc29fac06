package org.themecheck.checks;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-check configuration read from the {@code theme-check.checks} section:
 * <pre>
 * theme-check.checks {
 *   BlockIdUsage { enabled = true, severity = warning }
 * }
 * </pre>
 * Each entry is validated against the schema the check declares.
 */
public final class CheckConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CheckConfiguration.class);

    public static final String CHECKS_PATH = "theme-check.checks";
    public static final String DEFAULT_SOURCE = ".theme-check.conf";

    private final Config checks;
    private final String source;

    private CheckConfiguration(Config checks, String source) {
        this.checks = checks;
        this.source = source;
    }

    /**
     * Reads the checks section of a resolved application configuration.
     *
     * @param config The application configuration.
     * @param source The file the configuration came from, used as location of config-error offenses.
     */
    public static CheckConfiguration from(Config config, String source) {
        Config checks = config.hasPath(CHECKS_PATH) ? config.getConfig(CHECKS_PATH) : ConfigFactory.empty();
        return new CheckConfiguration(checks, source);
    }

    public static CheckConfiguration from(Config config) {
        return from(config, DEFAULT_SOURCE);
    }

    /**
     * @return A configuration in which every check uses its defaults.
     */
    public static CheckConfiguration empty() {
        return new CheckConfiguration(ConfigFactory.empty(), DEFAULT_SOURCE);
    }

    /**
     * @return The file the configuration came from.
     */
    public String source() {
        return source;
    }

    /**
     * Validates and resolves the settings of one check.
     *
     * @param meta The check's description.
     * @return The effective settings.
     * @throws CheckConfigurationException if the check's entry is malformed.
     */
    public CheckSettings settingsFor(CheckMeta meta) throws CheckConfigurationException {
        String code = meta.code();
        Config defaults = ConfigFactory.parseMap(meta.schema().defaults());
        boolean recommended = meta.docs() == null || meta.docs().recommended();

        if (!checks.hasPath(code)) {
            return new CheckSettings(recommended, meta.severity(), defaults);
        }
        if (checks.getValue(code).valueType() != ConfigValueType.OBJECT) {
            throw new CheckConfigurationException(code,
                    "Configuration of check " + code + " must be an object");
        }

        Config entry = checks.getConfig(code);
        boolean enabled = recommended;
        Severity severity = meta.severity();
        try {
            if (entry.hasPath(CheckSchema.ENABLED)) {
                enabled = entry.getBoolean(CheckSchema.ENABLED);
            }
            if (entry.hasPath(CheckSchema.SEVERITY)) {
                severity = Severity.parse(entry.getString(CheckSchema.SEVERITY));
            }
        } catch (ConfigException | IllegalArgumentException e) {
            throw new CheckConfigurationException(code,
                    "Invalid configuration for check " + code + ": " + e.getMessage(), e);
        }

        Config options = entry.withoutPath(CheckSchema.ENABLED).withoutPath(CheckSchema.SEVERITY);
        for (String key : options.root().keySet()) {
            CheckSchema.OptionSpec spec = meta.schema().option(key).orElse(null);
            if (spec == null) {
                log.warn("Ignoring unknown option '{}' of check {}", key, code);
                continue;
            }
            validate(code, options, spec);
        }
        return new CheckSettings(enabled, severity, options.withFallback(defaults));
    }

    private static void validate(String code, Config options, CheckSchema.OptionSpec spec)
            throws CheckConfigurationException {
        String key = spec.name();
        try {
            switch (spec.type()) {
                case BOOLEAN -> options.getBoolean(key);
                case STRING -> {
                    if (options.getValue(key).valueType() != ConfigValueType.STRING) {
                        throw new ConfigException.WrongType(options.origin(), key, "STRING",
                                options.getValue(key).valueType().name());
                    }
                }
                case INTEGER -> options.getInt(key);
                case STRING_LIST -> options.getStringList(key);
            }
        } catch (ConfigException e) {
            throw new CheckConfigurationException(code,
                    "Invalid value for option '" + key + "' of check " + code + ": expected "
                            + spec.type().name().toLowerCase() + " (" + e.getMessage() + ")", e);
        }
    }
}
