package org.themecheck.frontend.io;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Helpers for the {@code /}-separated, theme-relative paths used as module keys.
 */
public final class ThemePaths {

    private ThemePaths() {}

    /**
     * Normalizes a relative path: backslashes become slashes, {@code .} segments and leading slashes are
     * dropped and {@code ..} segments are resolved against their parent.
     *
     * @param path The path to normalize.
     * @return The normalized path.
     */
    public static String normalize(String path) {
        String[] parts = path.replace('\\', '/').split("/");
        Deque<String> segments = new ArrayDeque<>();
        for (String part : parts) {
            if (part.isEmpty() || part.equals(".")) continue;
            if (part.equals("..")) {
                segments.pollLast();
            } else {
                segments.addLast(part);
            }
        }
        return String.join("/", segments);
    }

    /**
     * Joins a root (path or URI) and a theme-relative path.
     */
    public static String join(String root, String relativePath) {
        String relative = normalize(relativePath);
        if (root.isEmpty()) return relative;
        return root.endsWith("/") ? root + relative : root + "/" + relative;
    }
}
