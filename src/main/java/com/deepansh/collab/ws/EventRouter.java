package com.deepansh.collab.ws;

import com.deepansh.collab.broadcast.ServerEvent;
import com.deepansh.collab.exception.CollabException;
import com.deepansh.collab.exception.ErrorKind;
import com.deepansh.collab.presence.ClientConnection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central dispatch for inbound WebSocket frames.
 *
 * Spring injects every {@link ClientEventHandler} bean; each event name is
 * indexed to its handler once at startup. Dispatch never throws: every
 * rejection becomes a single {@code error} event for the sender only.
 */
@Component
@Slf4j
public class EventRouter {

    private final Map<String, ClientEventHandler> handlers = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public EventRouter(List<ClientEventHandler> handlerBeans, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        handlerBeans.forEach(handler -> handler.events().forEach(event -> {
            ClientEventHandler clash = handlers.putIfAbsent(event, handler);
            if (clash != null) {
                throw new IllegalStateException("Event " + event + " handled by both "
                        + clash.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
        }));
        log.info("Registered {} client events: {}", handlers.size(), handlers.keySet());
    }

    public void dispatch(ClientConnection connection, String frame) {
        InboundEnvelope envelope;
        try {
            envelope = parse(frame);
        } catch (CollabException e) {
            sendError(connection, null, null, e.getKind(), e.getMessage());
            return;
        }

        ClientEventHandler handler = handlers.get(envelope.event());
        if (handler == null) {
            sendError(connection, envelope.event(), envelope.ref(), ErrorKind.BAD_REQUEST,
                    "Unknown event: " + envelope.event());
            return;
        }

        try {
            Object result = handler.handle(envelope.event(), connection, envelope.payload());
            if (envelope.ref() != null) {
                Map<String, Object> ack = new LinkedHashMap<>();
                ack.put("ref", envelope.ref());
                ack.put("event", envelope.event());
                ack.put("result", result);
                connection.send(ServerEvent.of(ServerEvent.ACK, ack));
            }
        } catch (CollabException e) {
            log.debug("Event rejected [event={}, userId={}, kind={}]: {}",
                    envelope.event(), connection.userId(), e.getKind().code(), e.getMessage());
            sendError(connection, envelope.event(), envelope.ref(), e.getKind(), e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error handling [event={}, userId={}]", envelope.event(), connection.userId(), e);
            sendError(connection, envelope.event(), envelope.ref(), ErrorKind.BAD_REQUEST,
                    "Request could not be processed");
        }
    }

    public boolean handles(String event) {
        return handlers.containsKey(event);
    }

    private InboundEnvelope parse(String frame) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw CollabException.badRequest("Malformed JSON frame");
        }
        if (root == null || !root.isObject() || !root.path("event").isTextual()) {
            throw CollabException.badRequest("Frame must be an object with a string 'event'");
        }
        JsonNode ref = root.get("ref");
        return new InboundEnvelope(
                root.get("event").asText(),
                root.get("payload"),
                ref == null || ref.isNull() ? null : ref.asText());
    }

    private void sendError(ClientConnection connection, String event, String ref, ErrorKind kind, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("code", kind);
        payload.put("message", message);
        if (event != null) payload.put("event", event);
        if (ref != null) payload.put("ref", ref);
        connection.send(ServerEvent.of(ServerEvent.ERROR, payload));
    }
}
