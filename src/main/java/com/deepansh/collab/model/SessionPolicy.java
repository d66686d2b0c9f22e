package com.deepansh.collab.model;

import lombok.Builder;

/**
 * Per-type rules for a session: capacity bounds, whether late joins are
 * accepted, how turns behave and which layout is dealt on start.
 *
 * @param defaultLayout layout name, or {@code null} for types without turn resources
 */
@Builder(toBuilder = true)
public record SessionPolicy(
        int minParticipants,
        int maxParticipants,
        boolean closedToJoinsWhenActive,
        boolean turnAdvances,
        boolean hostFirst,
        String defaultLayout
) {

    public boolean acceptsCapacity(int requested) {
        return requested >= minParticipants && requested <= maxParticipants;
    }
}
