package com.deepansh.collab.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * A seat in a session. Owned by its {@link Session}; every mutation happens
 * while the session monitor is held.
 */
@Getter
@Setter
@Builder
public class Participant {

    private final String userId;
    private String displayName;
    private String zodiacSign;
    private Role role;

    @Builder.Default
    private boolean online = true;

    private CursorPosition cursor;
    private VoiceState voiceState;

    private final Instant joinedAt;

    /** Strictly increasing per session; breaks host-transfer ties. */
    private final long joinSequence;

    public boolean isHost() {
        return role == Role.HOST;
    }
}
