package com.deepansh.collab.ws;

import com.deepansh.collab.presence.ClientConnection;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

/**
 * Handles a group of client events for one subsystem.
 *
 * Implementations throw {@link com.deepansh.collab.exception.CollabException}
 * to reject; the router turns it into an {@code error} event for the sender.
 */
public interface ClientEventHandler {

    /** Event names this handler accepts, e.g. "send_message". */
    Set<String> events();

    /**
     * @return result echoed in the {@code ack} when the request carried a ref; may be null
     */
    Object handle(String event, ClientConnection connection, JsonNode payload);
}
