package com.ambient.core.content;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Normalization rules shared by the content client and the content service.
 */
public final class ContentPaths {

    private ContentPaths() {}

    /**
     * Returns {@code raw} as an absolute path with duplicate separators and {@code .}
     * segments removed.
     *
     * @throws ContentPathException if the path is blank, resolves to the root, or contains a
     *                              {@code ..} segment
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ContentPathException("invalid path");
        }
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : raw.trim().replace('\\', '/').split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                throw new ContentPathException("invalid path");
            }
            segments.addLast(segment);
        }
        if (segments.isEmpty()) {
            throw new ContentPathException("invalid path");
        }
        return "/" + String.join("/", segments);
    }

    /**
     * Resolves {@code relative} under {@code root}. A blank relative path yields the root itself.
     */
    public static String resolve(String root, String relative) {
        String base = normalize(root);
        if (relative == null || relative.isBlank() || relative.trim().equals("/")) {
            return base;
        }
        return normalize(base + "/" + relative);
    }

    /** Last segment of a normalized path. */
    public static String fileName(String path) {
        String normalized = normalize(path);
        return normalized.substring(normalized.lastIndexOf('/') + 1);
    }
}
