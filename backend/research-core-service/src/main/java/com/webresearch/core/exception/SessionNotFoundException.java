package com.webresearch.core.exception;

public class SessionNotFoundException extends ResearchEngineException {

    public SessionNotFoundException(String sessionId) {
        super("SESSION_NOT_FOUND", "Research session not found: " + sessionId, sessionId);
    }
}
