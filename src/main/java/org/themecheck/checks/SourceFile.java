package org.themecheck.checks;

/**
 * A file handed to the checks.
 *
 * @param uri  The path or URI identifying the file.
 * @param text The full file text.
 */
public record SourceFile(String uri, String text) {
}
