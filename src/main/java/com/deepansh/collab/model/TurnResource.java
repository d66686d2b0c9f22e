package com.deepansh.collab.model;

import lombok.Getter;

import java.time.Instant;

/**
 * Shared object whose state changes are gated by turn rules, e.g. a card
 * in a reading. One per layout slot; the id doubles as the slot id.
 */
@Getter
public class TurnResource {

    private final String id;
    private final String position;
    private final String label;
    private final Orientation orientation;
    private boolean revealed;
    private String revealedBy;
    private Instant revealedAt;

    public TurnResource(String id, String label, Orientation orientation) {
        this.id = id;
        this.position = id;
        this.label = label;
        this.orientation = orientation;
    }

    public void reveal(String userId, Instant at) {
        if (revealed) {
            throw new IllegalStateException("Resource already revealed: " + id);
        }
        this.revealed = true;
        this.revealedBy = userId;
        this.revealedAt = at;
    }
}
