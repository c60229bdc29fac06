package org.themecheck.frontend.io;

/**
 * Kind of a file system entry.
 */
public enum FileType {
    FILE,
    DIRECTORY
}
