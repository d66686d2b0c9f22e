package com.deepansh.collab.ws;

import com.deepansh.collab.model.CursorUpdateRequest;
import com.deepansh.collab.presence.ClientConnection;
import com.deepansh.collab.presence.CursorRelay;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component
@RequiredArgsConstructor
public class CursorEventHandler implements ClientEventHandler {

    private final CursorRelay cursorRelay;
    private final PayloadBinder binder;

    @Override
    public Set<String> events() {
        return Set.of("cursor_update");
    }

    @Override
    public Object handle(String event, ClientConnection connection, JsonNode payload) {
        CursorUpdateRequest request = binder.bind(payload, CursorUpdateRequest.class);
        return cursorRelay.updateCursor(request.getSessionId(), connection.userId(),
                request.getX(), request.getY(), request.getElement());
    }
}
