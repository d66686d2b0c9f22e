package com.deepansh.collab.broadcast;

/**
 * Outbound envelope: {@code {"event": "...", "payload": {...}}}.
 */
public record ServerEvent(String event, Object payload) {

    public static final String SESSION_STATE = "session_state";
    public static final String SESSION_CREATED = "session_created";
    public static final String PRESENCE_UPDATE = "presence_update";
    public static final String CURSOR_UPDATE = "cursor_update";
    public static final String MESSAGE = "message";
    public static final String REACTION_ADDED = "reaction_added";
    public static final String TYPING_START = "typing_start";
    public static final String TYPING_STOP = "typing_stop";
    public static final String TURN_CHANGED = "turn_changed";
    public static final String RESOURCE_REVEALED = "resource_revealed";
    public static final String VOICE_STATE = "voice_state";
    public static final String VOICE_CREDENTIALS = "voice_credentials";
    public static final String SESSION_STATUS = "session_status";
    public static final String ACK = "ack";
    public static final String ERROR = "error";

    public static ServerEvent of(String event, Object payload) {
        return new ServerEvent(event, payload);
    }
}
