package com.deepansh.collab.ws;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Inbound frame: {@code {"event": "...", "payload": {...}, "ref": "..."}}.
 * {@code ref} is an optional client correlation id echoed on ack and error.
 */
public record InboundEnvelope(String event, JsonNode payload, String ref) {
}
