package org.themecheck.frontend.io;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches each call to a delegate chosen by the URI scheme of the path, e.g. {@code file:} paths to the
 * local disk and everything else to a remote host. Paths without a scheme go to the fallback delegate.
 */
public final class SchemeRoutingFileSystem implements IThemeFileSystem {

    private final Map<String, IThemeFileSystem> delegates = new HashMap<>();
    private final IThemeFileSystem fallback;

    /**
     * @param fallback The delegate for paths whose scheme has no registered delegate.
     */
    public SchemeRoutingFileSystem(IThemeFileSystem fallback) {
        this.fallback = fallback;
    }

    /**
     * Routes paths with the given scheme to {@code delegate}.
     *
     * @param scheme   The scheme without the colon, e.g. {@code file}.
     * @param delegate The file system serving that scheme.
     * @return This file system, for chaining.
     */
    public SchemeRoutingFileSystem register(String scheme, IThemeFileSystem delegate) {
        delegates.put(scheme.toLowerCase(), delegate);
        return this;
    }

    @Override
    public String readFile(String path) throws IOException {
        return route(path).readFile(path);
    }

    @Override
    public List<FileEntry> readDirectory(String path) throws IOException {
        return route(path).readDirectory(path);
    }

    @Override
    public FileStat stat(String path) throws IOException {
        return route(path).stat(path);
    }

    private IThemeFileSystem route(String path) {
        String scheme = schemeOf(path);
        if (scheme == null) {
            return fallback;
        }
        return delegates.getOrDefault(scheme, fallback);
    }

    /**
     * Extracts the scheme of a URI-like path. Single-letter schemes are treated as Windows drive letters.
     */
    static String schemeOf(String path) {
        int colon = path.indexOf(':');
        if (colon <= 1) {
            return null;
        }
        for (int i = 0; i < colon; i++) {
            char c = path.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '+' && c != '-' && c != '.') {
                return null;
            }
        }
        return path.substring(0, colon).toLowerCase();
    }
}
