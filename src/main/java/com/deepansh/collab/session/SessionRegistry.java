package com.deepansh.collab.session;

import com.deepansh.collab.exception.CollabException;
import com.deepansh.collab.model.Session;
import com.deepansh.collab.room.RoomDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory index of live sessions (waiting, active, and completed ones
 * still inside their retention window).
 */
@Component
@RequiredArgsConstructor
public class SessionRegistry {

    private final RoomDirectory roomDirectory;
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public void put(Session session) {
        sessions.put(session.getId(), session);
    }

    public Optional<Session> find(String sessionId) {
        if (sessionId == null) return Optional.empty();
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Session require(String sessionId) {
        return find(sessionId).orElseThrow(() -> CollabException.notFound("Session", sessionId));
    }

    /** Accepts either a room code or a session id. */
    public Session resolve(String sessionIdOrCode) {
        if (sessionIdOrCode == null || sessionIdOrCode.isBlank()) {
            throw CollabException.badRequest("sessionId or roomCode is required");
        }
        Optional<Session> byCode = roomDirectory.resolve(sessionIdOrCode).flatMap(this::find);
        return byCode.or(() -> find(sessionIdOrCode.trim()))
                .orElseThrow(() -> CollabException.notFound("Session", sessionIdOrCode));
    }

    public Optional<Session> remove(String sessionId) {
        return Optional.ofNullable(sessions.remove(sessionId));
    }

    public Collection<Session> all() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}
