package com.deepansh.collab.model;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Chat log entry. Immutable apart from the append-only reaction list, so
 * anything leaving the session monitor goes out as a {@link #copy()}.
 */
@Getter
@Builder(toBuilder = true)
@Jacksonized
public class Message {

    private final String id;
    private final String sessionId;
    private final String userId;
    private final String displayName;
    private final String content;
    private final Instant timestamp;
    private final MessageType type;

    /** Id of an earlier message in the same session. */
    private final String replyTo;

    /** Opaque id of something the message discusses, e.g. a card. */
    private final String attachedEntityId;

    @Builder.Default
    private final List<Reaction> reactions = new CopyOnWriteArrayList<>();

    /**
     * @return false when the same user already added the same symbol
     */
    public boolean addReaction(Reaction reaction) {
        boolean duplicate = reactions.stream()
                .anyMatch(r -> r.sameAs(reaction.userId(), reaction.symbol()));
        if (duplicate) return false;
        reactions.add(reaction);
        return true;
    }

    /** Frozen copy carrying the reactions present right now. */
    public Message copy() {
        return toBuilder().reactions(List.copyOf(reactions)).build();
    }
}
