package com.climbassessment.common.exception;

/**
 * The only hard failure of the core: a session whose landmark stream was null,
 * empty, or had no acceptable frame at all.
 */
public class EmptySessionException extends AssessmentException {
    private final String sessionId;

    public EmptySessionException(String sessionId) {
        super("[" + sessionId + "] Landmark stream is empty; nothing to assess");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
