package org.themecheck.frontend.io;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Serves theme files from the local disk. Accepts plain paths and {@code file:} URIs.
 *
 * <p>File text is returned exactly as stored, so offsets reported against it match the file on disk.</p>
 */
public final class LocalThemeFileSystem implements IThemeFileSystem {

    @Override
    public String readFile(String path) throws IOException {
        return Files.readString(toPath(path), StandardCharsets.UTF_8);
    }

    @Override
    public List<FileEntry> readDirectory(String path) throws IOException {
        Path directory = toPath(path);
        List<FileEntry> entries = new ArrayList<>();
        try (Stream<Path> children = Files.list(directory)) {
            children.sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .forEach(child -> entries.add(new FileEntry(
                            child.getFileName().toString(),
                            Files.isDirectory(child) ? FileType.DIRECTORY : FileType.FILE)));
        }
        return entries;
    }

    @Override
    public FileStat stat(String path) throws IOException {
        Path file = toPath(path);
        if (!Files.exists(file)) {
            throw new NoSuchFileException(path);
        }
        BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
        return attributes.isDirectory()
                ? new FileStat(FileType.DIRECTORY, 0)
                : new FileStat(FileType.FILE, attributes.size());
    }

    /**
     * Converts a plain path or {@code file:} URI to a {@link Path}.
     */
    static Path toPath(String path) {
        if (path.startsWith("file:")) {
            return Path.of(URI.create(path));
        }
        return Path.of(path);
    }
}
