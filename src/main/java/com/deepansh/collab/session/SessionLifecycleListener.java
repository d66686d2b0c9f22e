package com.deepansh.collab.session;

import com.deepansh.collab.model.Session;

/**
 * Hook for components that keep per-session side state (throttles, timers,
 * limiters) and must drop it when a participant or session goes away.
 * The first two callbacks run with the session monitor held.
 */
public interface SessionLifecycleListener {

    default void onParticipantRemoved(Session session, String userId) {
    }

    default void onSessionClosed(Session session) {
    }

    default void onSessionPurged(String sessionId) {
    }
}
