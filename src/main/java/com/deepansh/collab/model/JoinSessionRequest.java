package com.deepansh.collab.model;

import lombok.Data;

/**
 * Either {@code sessionId} or {@code roomCode} must be present.
 */
@Data
public class JoinSessionRequest {

    private String sessionId;
    private String roomCode;
    private String password;

    public String target() {
        if (roomCode != null && !roomCode.isBlank()) return roomCode;
        return sessionId;
    }
}
