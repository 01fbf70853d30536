package com.ambient.core.content;

/**
 * The per-tenant content service could not be reached or answered with an unexpected status.
 */
public class ContentServiceException extends RuntimeException {

    private final int upstreamStatus;

    public ContentServiceException(String message, int upstreamStatus) {
        super(message);
        this.upstreamStatus = upstreamStatus;
    }

    public ContentServiceException(String message, Throwable cause) {
        super(message, cause);
        this.upstreamStatus = -1;
    }

    /** HTTP status returned by the content service, or -1 if no response was received. */
    public int getUpstreamStatus() {
        return upstreamStatus;
    }
}
