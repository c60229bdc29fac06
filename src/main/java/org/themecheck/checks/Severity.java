package org.themecheck.checks;

import java.util.Locale;

/**
 * Severity of an {@link Offense}.
 */
public enum Severity {
    ERROR,
    WARNING,
    INFO;

    /**
     * Parses a severity name case-insensitively.
     *
     * @param value One of {@code error}, {@code warning}, {@code info}.
     * @return The matching severity.
     * @throws IllegalArgumentException if the value names no severity.
     */
    public static Severity parse(String value) {
        for (Severity severity : values()) {
            if (severity.name().equalsIgnoreCase(value.trim())) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity '" + value + "', expected one of error, warning, info");
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
