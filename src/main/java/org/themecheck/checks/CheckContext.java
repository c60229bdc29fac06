package org.themecheck.checks;

import com.typesafe.config.Config;
import org.themecheck.frontend.io.IThemeFileSystem;
import org.themecheck.frontend.parser.ast.Position;

import java.util.Optional;

/**
 * Reporting context of one check for one file. Gives the check's handlers read access to the file and,
 * when the run has one, to the theme's file system.
 */
public final class CheckContext {

    private final CheckMeta meta;
    private final CheckSettings settings;
    private final SourceFile file;
    private final IThemeFileSystem fileSystem;
    private final OffenseCollector offenses;

    CheckContext(CheckMeta meta, CheckSettings settings, SourceFile file,
                 IThemeFileSystem fileSystem, OffenseCollector offenses) {
        this.meta = meta;
        this.settings = settings;
        this.file = file;
        this.fileSystem = fileSystem;
        this.offenses = offenses;
    }

    public SourceFile file() {
        return file;
    }

    public String fileUri() {
        return file.uri();
    }

    public String text() {
        return file.text();
    }

    /**
     * @return The check-specific options, schema defaults included.
     */
    public Config options() {
        return settings.options();
    }

    /**
     * @return The severity offenses of this check are reported with.
     */
    public Severity severity() {
        return settings.severity();
    }

    /**
     * @return The theme's file system for cross-file lookups, if the run has one.
     */
    public Optional<IThemeFileSystem> fileSystem() {
        return Optional.ofNullable(fileSystem);
    }

    /**
     * Reports an offense over {@code [startIndex, endIndex)} of the current file.
     * The range is clamped to the bounds of the file text.
     */
    public void report(String message, int startIndex, int endIndex) {
        report(message, startIndex, endIndex, null);
    }

    public void report(String message, Position position) {
        report(message, position.start(), position.end(), null);
    }

    /**
     * Reports an offense with a fix suggestion.
     *
     * @param suggestion Human-readable fix hint, or {@code null}.
     */
    public void report(String message, int startIndex, int endIndex, String suggestion) {
        offenses.add(new Offense(meta.code(), settings.severity(), message, file.uri(),
                clamp(startIndex, endIndex), suggestion));
    }

    void reportInternalError(Position position, Throwable error) {
        if (error instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        String detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        offenses.add(new Offense(meta.code(), Severity.ERROR,
                "Internal error in check " + meta.code() + ": " + detail,
                file.uri(), clamp(position.start(), position.end()), null));
    }

    private Position clamp(int startIndex, int endIndex) {
        int length = file.text().length();
        int start = Math.max(0, Math.min(startIndex, length));
        int end = Math.max(start, Math.min(endIndex, length));
        return new Position(start, end);
    }
}
