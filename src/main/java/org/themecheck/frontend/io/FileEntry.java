package org.themecheck.frontend.io;

/**
 * One entry of a directory listing.
 *
 * @param name The entry name without any directory component.
 * @param type Whether the entry is a file or a directory.
 */
public record FileEntry(String name, FileType type) {
}
