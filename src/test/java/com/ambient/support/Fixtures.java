package com.ambient.support;

import com.ambient.core.model.LlmSettings;
import com.ambient.core.model.ResourceMeta;
import com.ambient.core.model.Session;
import com.ambient.core.model.SessionPhase;
import com.ambient.core.model.SessionSpec;
import com.ambient.core.model.SessionStatus;

import java.util.Map;

/**
 * Small builders for test resources.
 */
public final class Fixtures {

    private Fixtures() {}

    public static SessionSpec spec(String prompt) {
        return new SessionSpec(prompt, null, null, null, new LlmSettings("sonnet", 0.7, 4000), 300,
                null, null, null, null, null, null, null);
    }

    public static Session session(String namespace, String name, SessionPhase phase) {
        ResourceMeta meta = new ResourceMeta(name, namespace, "uid-" + name, "1", "2025-01-01T00:00:00Z",
                Map.of(), Map.of());
        SessionStatus status = phase == null ? null : SessionStatus.phase(phase, null);
        return Session.of(meta, spec("do the thing"), status);
    }
}
