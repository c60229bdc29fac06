package org.themecheck.checks;

import com.typesafe.config.Config;

/**
 * The validated configuration of one check for one run.
 *
 * @param enabled  Whether the check runs.
 * @param severity The effective severity of the check's offenses.
 * @param options  Check-specific options, with schema defaults filled in.
 */
public record CheckSettings(boolean enabled, Severity severity, Config options) {
}
