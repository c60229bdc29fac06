package org.themecheck.checks;

/**
 * A rule that inspects syntax-tree nodes and reports offenses.
 * Definitions are registered once in a {@link CheckRegistry} and must be stateless; all per-file state
 * lives in the handlers returned by {@link #create(CheckContext)}.
 */
public interface ICheckDefinition {

    /**
     * @return The check's static description.
     */
    CheckMeta meta();

    /**
     * Creates the handlers for one file.
     *
     * @param context The reporting context for this check and file.
     * @return The handlers keyed by node kind.
     */
    HandlerTable create(CheckContext context);
}
