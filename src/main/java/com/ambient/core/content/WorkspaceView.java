package com.ambient.core.content;

import java.util.List;

/**
 * What a workspace path resolved to: either a directory listing or a single file's bytes.
 */
public record WorkspaceView(List<ContentEntry> entries, byte[] file) {

    public static WorkspaceView directory(List<ContentEntry> entries) {
        return new WorkspaceView(entries, null);
    }

    public static WorkspaceView file(byte[] data) {
        return new WorkspaceView(null, data);
    }

    public boolean isFile() {
        return file != null;
    }
}
