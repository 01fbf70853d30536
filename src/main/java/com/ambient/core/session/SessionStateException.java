package com.ambient.core.session;

import com.ambient.core.model.SessionPhase;

/**
 * A lifecycle operation asked for a phase change the session's current phase does not allow.
 */
public class SessionStateException extends RuntimeException {

    private final SessionPhase current;
    private final SessionPhase requested;

    public SessionStateException(String message, SessionPhase current, SessionPhase requested) {
        super(message);
        this.current = current;
        this.requested = requested;
    }

    public SessionPhase getCurrent() {
        return current;
    }

    public SessionPhase getRequested() {
        return requested;
    }
}
