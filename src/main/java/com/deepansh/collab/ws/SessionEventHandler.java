package com.deepansh.collab.ws;

import com.deepansh.collab.broadcast.ServerEvent;
import com.deepansh.collab.model.CreateSessionRequest;
import com.deepansh.collab.model.JoinSessionRequest;
import com.deepansh.collab.model.SessionRequest;
import com.deepansh.collab.model.SessionSnapshot;
import com.deepansh.collab.presence.ClientConnection;
import com.deepansh.collab.session.SessionLifecycleManager;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class SessionEventHandler implements ClientEventHandler {

    private final SessionLifecycleManager lifecycleManager;
    private final PayloadBinder binder;

    @Override
    public Set<String> events() {
        return Set.of("create_session", "join_session", "leave_session",
                "start_session", "end_session", "request_state");
    }

    @Override
    public Object handle(String event, ClientConnection connection, JsonNode payload) {
        String userId = connection.userId();
        return switch (event) {
            case "create_session" -> {
                CreateSessionRequest request = binder.bind(payload, CreateSessionRequest.class);
                SessionSnapshot created = lifecycleManager.createSession(connection.identity(), request, connection);
                yield Map.of("sessionId", created.id(), "roomCode", created.roomCode());
            }
            case "join_session" -> {
                JoinSessionRequest request = binder.bind(payload, JoinSessionRequest.class);
                SessionSnapshot joined = lifecycleManager.joinSession(
                        request.target(), connection.identity(), request.getPassword(), connection);
                yield Map.of("sessionId", joined.id());
            }
            case "leave_session" -> {
                String sessionId = binder.bind(payload, SessionRequest.class).getSessionId();
                lifecycleManager.leaveSession(sessionId, userId);
                yield Map.of("sessionId", sessionId);
            }
            case "start_session" -> {
                SessionSnapshot started = lifecycleManager.startSession(
                        binder.bind(payload, SessionRequest.class).getSessionId(), userId);
                yield Map.of("sessionId", started.id(), "status", started.status());
            }
            case "end_session" -> {
                String sessionId = binder.bind(payload, SessionRequest.class).getSessionId();
                lifecycleManager.endSession(sessionId, userId);
                yield Map.of("sessionId", sessionId);
            }
            case "request_state" -> {
                SessionSnapshot snapshot = lifecycleManager.snapshotFor(
                        binder.bind(payload, SessionRequest.class).getSessionId(), userId);
                connection.send(ServerEvent.of(ServerEvent.SESSION_STATE, snapshot));
                yield null;
            }
            default -> throw new IllegalArgumentException("Unsupported event: " + event);
        };
    }
}
