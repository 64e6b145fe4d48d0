package com.assessmentplatform.orchestrator.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/** Live sessions of this orchestrator instance. Nothing is shared between sessions. */
@Component
public class AssessmentSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(AssessmentSessionRegistry.class);

    private final Map<String, AssessmentSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public AssessmentSessionRegistry(Clock clock) {
        this.clock = clock;
    }

    public AssessmentSession create() {
        AssessmentSession session = new AssessmentSession(UUID.randomUUID().toString(), clock);
        sessions.put(session.id(), session);
        log.info("Assessment session created. sessionId={} active={}", session.id(), sessions.size());
        return session;
    }

    /** @throws SessionNotFoundException when no live session has this id */
    public AssessmentSession get(String sessionId) {
        AssessmentSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    /**
     * Removes the session; results of its in-flight specialist calls are ignored from now on.
     *
     * @throws SessionNotFoundException when no live session has this id
     */
    public void discard(String sessionId) {
        AssessmentSession session = sessions.remove(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        session.discard();
        log.info("Assessment session discarded. sessionId={} active={}", sessionId, sessions.size());
    }

    public int size() {
        return sessions.size();
    }
}
