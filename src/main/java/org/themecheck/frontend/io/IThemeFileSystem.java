package org.themecheck.frontend.io;

import java.io.IOException;
import java.util.List;

/**
 * All file access of checks and of the theme graph goes through this interface, so themes can live on
 * local disk, in memory or behind a remote host. Paths use {@code /} as separator.
 */
public interface IThemeFileSystem {

    /**
     * @param path The file path.
     * @return The file text.
     * @throws java.nio.file.NoSuchFileException if the file does not exist.
     * @throws IOException if the file cannot be read.
     */
    String readFile(String path) throws IOException;

    /**
     * @param path The directory path.
     * @return The directory entries sorted by name.
     * @throws IOException if the directory does not exist or cannot be listed.
     */
    List<FileEntry> readDirectory(String path) throws IOException;

    /**
     * @param path The entry path.
     * @return The entry metadata.
     * @throws java.nio.file.NoSuchFileException if the entry does not exist.
     * @throws IOException if the metadata cannot be read.
     */
    FileStat stat(String path) throws IOException;

    /**
     * @return true if {@link #stat(String)} succeeds for {@code path}.
     * @throws IOException if existence cannot be determined for another reason.
     */
    default boolean exists(String path) throws IOException {
        try {
            stat(path);
            return true;
        } catch (java.nio.file.NoSuchFileException e) {
            return false;
        }
    }
}
