package org.themecheck.checks;

/**
 * @param description What the check reports and why.
 * @param url         Link to the full documentation, may be {@code null}.
 * @param recommended Whether the check is enabled when the configuration does not mention it.
 */
public record CheckDocs(String description, String url, boolean recommended) {
}
