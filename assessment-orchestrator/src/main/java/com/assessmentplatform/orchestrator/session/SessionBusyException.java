package com.assessmentplatform.orchestrator.session;

/** A navigation request arrived while another one for the same session was still running. */
public class SessionBusyException extends RuntimeException {
    private final String sessionId;

    public SessionBusyException(String sessionId, String operation) {
        super("Session " + sessionId + " is busy; " + operation + " rejected");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
