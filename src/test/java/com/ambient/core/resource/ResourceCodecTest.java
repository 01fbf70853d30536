package com.ambient.core.resource;

import com.ambient.core.model.Session;
import com.ambient.core.model.SessionPhase;
import com.ambient.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResourceCodecTest {

    private final ResourceCodec codec = new ResourceCodec();

    @Test
    @DisplayName("decodes a raw custom object into a typed session")
    void decodesSession() {
        Map<String, Object> raw = Map.of(
                "apiVersion", "vteam.ambient-code/v1alpha1",
                "kind", "AgenticSession",
                "metadata", Map.of("name", "s1", "namespace", "team-a", "uid", "u-1", "resourceVersion", "7"),
                "spec", Map.of("prompt", "hi", "timeout", 300.0, "somethingNew", true),
                "status", Map.of("phase", "Running", "numTurns", 4));

        Session session = codec.decode(raw, Session.class);

        assertEquals("s1", session.name());
        assertEquals("7", session.metadata().resourceVersion());
        assertEquals(300, session.spec().timeout());
        assertEquals(SessionPhase.RUNNING, session.phase());
        assertEquals(4, session.status().numTurns());
    }

    @Test
    @DisplayName("encoding leaves out absent fields")
    void encodesWithoutNulls() {
        Map<String, Object> encoded = codec.encode(Fixtures.session("team-a", "s1", null));

        assertEquals("AgenticSession", encoded.get("kind"));
        assertFalse(encoded.containsKey("status"));
        @SuppressWarnings("unchecked")
        Map<String, Object> spec = (Map<String, Object>) encoded.get("spec");
        assertEquals("do the thing", spec.get("prompt"));
        assertFalse(spec.containsKey("gitConfig"));
    }

    @Test
    @DisplayName("an unknown phase is a decoding error")
    void unknownPhase() {
        Map<String, Object> raw = Map.of("status", Map.of("phase", "Sleeping"));

        assertThrows(ResourceDecodingException.class, () -> codec.decode(raw, Session.class));
    }

    @Test
    @DisplayName("null decodes to null")
    void decodesNull() {
        assertNull(codec.decode(null, Session.class));
    }
}
