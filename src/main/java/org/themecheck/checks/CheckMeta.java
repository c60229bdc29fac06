package org.themecheck.checks;

import java.util.Objects;

/**
 * Static description of a check.
 *
 * @param code     Unique identifier, also the key of the check's configuration entry.
 * @param name     Short title.
 * @param docs     Documentation.
 * @param severity Default severity, overridable by configuration.
 * @param schema   The options the check accepts.
 */
public record CheckMeta(String code, String name, CheckDocs docs, Severity severity, CheckSchema schema) {

    public CheckMeta {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(schema, "schema");
    }
}
