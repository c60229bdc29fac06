package org.themecheck.checks;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The check-specific options a check accepts, each with a type and a default value.
 * The keys {@code enabled} and {@code severity} are common to all checks and cannot be declared.
 */
public final class CheckSchema {

    /** Keys every check accepts. */
    public static final String ENABLED = "enabled";
    public static final String SEVERITY = "severity";

    private static final CheckSchema EMPTY = new CheckSchema(Map.of());

    /**
     * @param name         The option key.
     * @param type         The expected value type.
     * @param defaultValue The value used when the configuration omits the option.
     */
    public record OptionSpec(String name, OptionType type, Object defaultValue) {}

    private final Map<String, OptionSpec> options;

    private CheckSchema(Map<String, OptionSpec> options) {
        this.options = Collections.unmodifiableMap(options);
    }

    public static CheckSchema empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<OptionSpec> option(String name) {
        return Optional.ofNullable(options.get(name));
    }

    /**
     * @return The declared options in declaration order.
     */
    public Map<String, OptionSpec> options() {
        return options;
    }

    /**
     * @return Option name to default value, for use as a configuration fallback.
     */
    public Map<String, Object> defaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        options.values().forEach(spec -> defaults.put(spec.name(), spec.defaultValue()));
        return defaults;
    }

    public static final class Builder {
        private final Map<String, OptionSpec> options = new LinkedHashMap<>();

        public Builder booleanOption(String name, boolean defaultValue) {
            return add(new OptionSpec(name, OptionType.BOOLEAN, defaultValue));
        }

        public Builder stringOption(String name, String defaultValue) {
            return add(new OptionSpec(name, OptionType.STRING, defaultValue));
        }

        public Builder integerOption(String name, int defaultValue) {
            return add(new OptionSpec(name, OptionType.INTEGER, defaultValue));
        }

        public Builder stringListOption(String name, List<String> defaultValue) {
            return add(new OptionSpec(name, OptionType.STRING_LIST, List.copyOf(defaultValue)));
        }

        private Builder add(OptionSpec spec) {
            if (ENABLED.equals(spec.name()) || SEVERITY.equals(spec.name())) {
                throw new IllegalArgumentException("Option name '" + spec.name() + "' is reserved");
            }
            if (options.putIfAbsent(spec.name(), spec) != null) {
                throw new IllegalArgumentException("Duplicate option '" + spec.name() + "'");
            }
            return this;
        }

        public CheckSchema build() {
            return new CheckSchema(new LinkedHashMap<>(options));
        }
    }
}
