package com.assessmentplatform.orchestrator.session;

public class SessionNotFoundException extends RuntimeException {
    public SessionNotFoundException(String sessionId) {
        super("No assessment session " + sessionId);
    }
}
