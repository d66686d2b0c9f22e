package com.deepansh.collab.session;

import com.deepansh.collab.exception.CollabException;
import com.deepansh.collab.model.Participant;
import com.deepansh.collab.model.Session;

/**
 * Validation shared by every component that acts on a session.
 * Call with the session monitor held.
 */
public final class SessionGuards {

    private SessionGuards() {
    }

    public static void requireOpen(Session session) {
        if (session.isTerminal()) {
            throw CollabException.sessionClosed(session.getId());
        }
    }

    public static Participant requireParticipant(Session session, String userId) {
        return session.participant(userId)
                .orElseThrow(() -> CollabException.unauthorized(
                        "User " + userId + " is not a participant of session " + session.getId()));
    }

    public static void requireHost(Session session, String userId) {
        if (!session.getHostId().equals(userId)) {
            throw CollabException.unauthorized("Only the host can do that");
        }
    }
}
