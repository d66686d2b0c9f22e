package com.deepansh.collab.ws;

import com.deepansh.collab.model.UserIdentity;
import com.deepansh.collab.presence.ClientConnection;
import com.deepansh.collab.presence.PresenceStore;
import com.deepansh.collab.session.SessionLifecycleManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Bridges Spring WebSocket sessions to engine connections.
 *
 * Inbound frames are dispatched on the container thread; all outbound
 * traffic goes through the connection's ordered mailbox.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CollabWebSocketHandler extends TextWebSocketHandler {

    static final String CONNECTION_ATTRIBUTE = "collab.connection";

    private final PresenceStore presenceStore;
    private final SessionLifecycleManager lifecycleManager;
    private final EventRouter eventRouter;
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        UserIdentity identity = (UserIdentity) session.getAttributes().get(HandshakeIdentityInterceptor.IDENTITY_ATTRIBUTE);
        if (identity == null) {
            log.warn("WebSocket opened without identity, closing [id={}]", session.getId());
            new WebSocketClientChannel(session, objectMapper).close("identity required");
            return;
        }

        PresenceStore.Registration registration =
                presenceStore.register(identity, new WebSocketClientChannel(session, objectMapper));
        session.getAttributes().put(CONNECTION_ATTRIBUTE, registration.connection());
        lifecycleManager.onConnected(registration);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ClientConnection connection = connection(session);
        if (connection == null) return;
        eventRouter.dispatch(connection, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket transport error [id={}]: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ClientConnection connection = connection(session);
        if (connection == null) return;
        log.info("WebSocket closed [id={}, userId={}, status={}]", session.getId(), connection.userId(), status);
        connection.close("transport closed");
        lifecycleManager.onDisconnected(connection);
    }

    private static ClientConnection connection(WebSocketSession session) {
        return (ClientConnection) session.getAttributes().get(CONNECTION_ATTRIBUTE);
    }
}
