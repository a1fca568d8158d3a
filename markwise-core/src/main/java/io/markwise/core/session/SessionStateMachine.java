package io.markwise.core.session;

import io.markwise.core.model.Session;
import io.markwise.core.model.SessionStatus;
import io.markwise.core.store.SessionStore;
import java.io.IOException;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SessionStateMachine {
    private static final Logger LOG = LoggerFactory.getLogger(SessionStateMachine.class);
    private static final Map<SessionStatus, Set<SessionStatus>> ALLOWED = Map.of(
        SessionStatus.CREATED, EnumSet.of(SessionStatus.GRADING),
        SessionStatus.GRADING, EnumSet.of(SessionStatus.GRADED, SessionStatus.FAILED),
        SessionStatus.GRADED, EnumSet.of(SessionStatus.GRADING),
        SessionStatus.FAILED, EnumSet.of(SessionStatus.GRADING)
    );

    private final SessionStore store;

    public SessionStateMachine(SessionStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    public static boolean isAllowed(SessionStatus from, SessionStatus to) {
        return ALLOWED.getOrDefault(from, Set.of()).contains(to);
    }

    public boolean begin(String sessionId) {
        return transition(sessionId, SessionStatus.GRADING);
    }

    public boolean complete(String sessionId, boolean anyAnswers) {
        return transition(sessionId, anyAnswers ? SessionStatus.GRADED : SessionStatus.FAILED);
    }

    public boolean fail(String sessionId) {
        return transition(sessionId, SessionStatus.FAILED);
    }

    private boolean transition(String sessionId, SessionStatus target) {
        try {
            Optional<Session> session = store.find(sessionId);
            if (session.isEmpty()) {
                LOG.warn("Cannot move unknown session {} to {}", sessionId, target.wireValue());
                return false;
            }
            SessionStatus current = session.get().status();
            if (current == target) {
                return true;
            }
            if (!isAllowed(current, target)) {
                LOG.warn("Skipping illegal session transition {} -> {} for {}",
                    current.wireValue(), target.wireValue(), sessionId);
                return false;
            }
            store.updateStatus(sessionId, target);
            LOG.info("Session {} {} -> {}", sessionId, current.wireValue(), target.wireValue());
            return true;
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to move session {} to {}", sessionId, target.wireValue(), e);
            return false;
        }
    }
}
