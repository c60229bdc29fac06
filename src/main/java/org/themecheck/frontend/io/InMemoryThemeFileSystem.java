package org.themecheck.frontend.io;

import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A virtual theme held in memory. Directories exist implicitly as prefixes of file paths.
 */
public final class InMemoryThemeFileSystem implements IThemeFileSystem {

    private final Map<String, String> files = new TreeMap<>();

    public InMemoryThemeFileSystem() {
    }

    public InMemoryThemeFileSystem(Map<String, String> files) {
        files.forEach(this::put);
    }

    /**
     * Adds or replaces a file.
     *
     * @param path The file path.
     * @param text The file text.
     * @return This file system, for chaining.
     */
    public InMemoryThemeFileSystem put(String path, String text) {
        files.put(normalize(path), text);
        return this;
    }

    @Override
    public String readFile(String path) throws NoSuchFileException {
        String text = files.get(normalize(path));
        if (text == null) {
            throw new NoSuchFileException(path);
        }
        return text;
    }

    @Override
    public List<FileEntry> readDirectory(String path) throws NoSuchFileException {
        String prefix = normalize(path) + "/";
        TreeSet<String> fileNames = new TreeSet<>();
        TreeSet<String> directoryNames = new TreeSet<>();
        for (String file : files.keySet()) {
            if (!file.startsWith(prefix)) continue;
            String rest = file.substring(prefix.length());
            int slash = rest.indexOf('/');
            if (slash < 0) {
                fileNames.add(rest);
            } else {
                directoryNames.add(rest.substring(0, slash));
            }
        }
        if (fileNames.isEmpty() && directoryNames.isEmpty()) {
            throw new NoSuchFileException(path);
        }
        TreeMap<String, FileType> merged = new TreeMap<>();
        directoryNames.forEach(name -> merged.put(name, FileType.DIRECTORY));
        fileNames.forEach(name -> merged.put(name, FileType.FILE));
        List<FileEntry> entries = new ArrayList<>();
        merged.forEach((name, type) -> entries.add(new FileEntry(name, type)));
        return entries;
    }

    @Override
    public FileStat stat(String path) throws NoSuchFileException {
        String normalized = normalize(path);
        String text = files.get(normalized);
        if (text != null) {
            return new FileStat(FileType.FILE, text.length());
        }
        String prefix = normalized + "/";
        for (String file : files.keySet()) {
            if (file.startsWith(prefix)) {
                return new FileStat(FileType.DIRECTORY, 0);
            }
        }
        throw new NoSuchFileException(path);
    }

    private static String normalize(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.endsWith("/") && normalized.length() > 1) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
