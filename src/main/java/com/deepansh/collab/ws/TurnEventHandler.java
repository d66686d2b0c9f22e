package com.deepansh.collab.ws;

import com.deepansh.collab.model.RevealResourceRequest;
import com.deepansh.collab.presence.ClientConnection;
import com.deepansh.collab.turn.TurnCoordinator;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component
@RequiredArgsConstructor
public class TurnEventHandler implements ClientEventHandler {

    private final TurnCoordinator turnCoordinator;
    private final PayloadBinder binder;

    @Override
    public Set<String> events() {
        return Set.of("reveal_resource");
    }

    @Override
    public Object handle(String event, ClientConnection connection, JsonNode payload) {
        RevealResourceRequest request = binder.bind(payload, RevealResourceRequest.class);
        return turnCoordinator.performAction(request.getSessionId(), connection.userId(), request.getResourceId());
    }
}
