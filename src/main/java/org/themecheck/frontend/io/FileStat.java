package org.themecheck.frontend.io;

/**
 * Metadata about a file system entry.
 *
 * @param type The entry type.
 * @param size The size in bytes; zero for directories.
 */
public record FileStat(FileType type, long size) {
}
