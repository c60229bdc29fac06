package org.themecheck.checks;

/**
 * Value types a check option may declare.
 */
public enum OptionType {
    BOOLEAN,
    STRING,
    INTEGER,
    STRING_LIST
}
