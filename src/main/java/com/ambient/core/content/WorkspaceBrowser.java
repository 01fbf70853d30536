package com.ambient.core.content;

import com.ambient.core.cluster.NotFoundException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Browsing and writing under a workspace root (a session's or a workflow's) through the
 * content service.
 */
@Service
public class WorkspaceBrowser {

    private final ContentServiceClient content;

    public WorkspaceBrowser(ContentServiceClient content) {
        this.content = content;
    }

    /**
     * Resolves a workspace-relative path, or an absolute path already inside the root, to an
     * absolute content path. Blank and {@code /} resolve to the root.
     *
     * @throws ContentPathException if the result would leave the root
     */
    public static String resolveUnder(String root, String relativeOrAbsolute) {
        String base = ContentPaths.normalize(root);
        if (relativeOrAbsolute == null || relativeOrAbsolute.isBlank() || relativeOrAbsolute.trim().equals("/")) {
            return base;
        }
        String cleaned = "/" + relativeOrAbsolute.trim().replaceFirst("^/+", "");
        if (cleaned.equals(base) || cleaned.startsWith(base + "/")) {
            return ContentPaths.normalize(cleaned);
        }
        return ContentPaths.resolve(base, cleaned);
    }

    /**
     * Lists the path; a listing that is exactly this one file is returned as the file's bytes.
     * When listing fails with not-found the path is read directly.
     */
    public WorkspaceView open(String namespace, String token, String root, String path) {
        String absolute = resolveUnder(root, path);
        List<ContentEntry> entries;
        try {
            entries = content.list(namespace, token, absolute);
        } catch (NotFoundException e) {
            return WorkspaceView.file(content.read(namespace, token, absolute));
        }
        if (entries.size() == 1 && !entries.get(0).isDir()
                && stripTrailingSlash(entries.get(0).path()).equals(absolute)) {
            return WorkspaceView.file(content.read(namespace, token, absolute));
        }
        return WorkspaceView.directory(entries);
    }

    public void write(String namespace, String token, String root, String path, byte[] data) {
        content.write(namespace, token, resolveUnder(root, path), data);
    }

    private static String stripTrailingSlash(String path) {
        String result = path == null ? "" : path;
        while (result.length() > 1 && result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
