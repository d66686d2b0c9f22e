package com.deepansh.collab.ws;

import com.deepansh.collab.broadcast.ClientChannel;
import com.deepansh.collab.broadcast.ServerEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link ClientChannel} over a Spring {@link WebSocketSession}. Events are
 * written as JSON text frames.
 */
@Slf4j
public class WebSocketClientChannel implements ClientChannel {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public WebSocketClientChannel(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void deliver(ServerEvent event) throws IOException {
        String json = objectMapper.writeValueAsString(event);
        synchronized (session) {
            session.sendMessage(new TextMessage(json));
        }
    }

    @Override
    public void close(String reason) {
        if (!session.isOpen()) return;
        try {
            synchronized (session) {
                session.close(CloseStatus.POLICY_VIOLATION.withReason(reason));
            }
        } catch (IOException e) {
            log.warn("Failed to close WebSocket [id={}]: {}", session.getId(), e.getMessage());
        }
    }
}
