package org.themecheck.frontend.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Lists the files below a directory of a theme through an {@link IThemeFileSystem}.
 */
public final class ThemeFileWalker {

    private static final Logger log = LoggerFactory.getLogger(ThemeFileWalker.class);

    private ThemeFileWalker() {}

    /**
     * Recursively lists the files below {@code relativeDirectory}. A missing directory yields no files;
     * a directory that cannot be listed is logged and skipped.
     *
     * @param fileSystem        The theme's file system.
     * @param root              The theme root.
     * @param relativeDirectory The directory to list, relative to the root; empty for the root itself.
     * @return Theme-relative file paths, each directory's entries in name order, files before subdirectories.
     */
    public static List<String> listFiles(IThemeFileSystem fileSystem, String root, String relativeDirectory) {
        List<String> files = new ArrayList<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.add(ThemePaths.normalize(relativeDirectory));
        while (!pending.isEmpty()) {
            String directory = pending.poll();
            List<FileEntry> entries;
            try {
                entries = fileSystem.readDirectory(ThemePaths.join(root, directory));
            } catch (NoSuchFileException e) {
                log.debug("Theme directory {} does not exist", directory);
                continue;
            } catch (IOException e) {
                log.warn("Could not list theme directory {}", directory, e);
                continue;
            }
            List<String> subdirectories = new ArrayList<>();
            for (FileEntry entry : entries) {
                String path = directory.isEmpty() ? entry.name() : directory + "/" + entry.name();
                if (entry.type() == FileType.DIRECTORY) {
                    subdirectories.add(path);
                } else {
                    files.add(path);
                }
            }
            subdirectories.forEach(pending::add);
        }
        return files;
    }
}
