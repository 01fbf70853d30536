package com.ambient.core.content;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ContentPathsTest {

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @Test
        @DisplayName("adds a leading slash and collapses duplicate separators")
        void collapses() {
            assertEquals("/sessions/s1/messages.json", ContentPaths.normalize("sessions//s1/./messages.json"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"../etc/passwd", "/sessions/../../x", "/a/..", "..", "a/../b"})
        @DisplayName("rejects any parent-traversal segment")
        void rejectsTraversal(String path) {
            assertThrows(ContentPathException.class, () -> ContentPaths.normalize(path));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "/", "//", "/./"})
        @DisplayName("rejects blank and root paths")
        void rejectsRoot(String path) {
            assertThrows(ContentPathException.class, () -> ContentPaths.normalize(path));
        }

        @Test
        @DisplayName("allows dots inside a segment name")
        void dotsInNames() {
            assertEquals("/a/..hidden/file..txt", ContentPaths.normalize("/a/..hidden/file..txt"));
        }
    }

    @Test
    @DisplayName("resolve joins a relative path under a root")
    void resolve() {
        assertEquals("/sessions/s1/workspace/out/report.md",
                ContentPaths.resolve("/sessions/s1/workspace", "out/report.md"));
        assertEquals("/sessions/s1/workspace", ContentPaths.resolve("/sessions/s1/workspace", ""));
        assertThrows(ContentPathException.class,
                () -> ContentPaths.resolve("/sessions/s1/workspace", "../../s2/workspace"));
    }

    @Test
    @DisplayName("fileName returns the last segment")
    void fileName() {
        assertEquals("plan.md", ContentPaths.fileName("/rfe-workflows/rfe-1/workspace/specs/plan.md"));
    }
}
