package org.themecheck.checks;

import org.themecheck.frontend.parser.ast.Position;

import java.util.Objects;
import java.util.Optional;

/**
 * One reported diagnostic.
 *
 * @param checkCode  The code of the check that reported it.
 * @param severity   The effective severity.
 * @param message    Human-readable description.
 * @param fileUri    The file the offense refers to.
 * @param position   The offending range within that file.
 * @param suggestion An optional fix hint, {@code null} when absent.
 */
public record Offense(
        String checkCode,
        Severity severity,
        String message,
        String fileUri,
        Position position,
        String suggestion
) {

    public Offense {
        Objects.requireNonNull(checkCode, "checkCode");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(fileUri, "fileUri");
        Objects.requireNonNull(position, "position");
    }

    public Offense(String checkCode, Severity severity, String message, String fileUri, Position position) {
        this(checkCode, severity, message, fileUri, position, null);
    }

    public Optional<String> optionalSuggestion() {
        return Optional.ofNullable(suggestion);
    }
}
