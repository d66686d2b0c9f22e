package com.deepansh.collab.model;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative in-memory state of one collaborative session.
 *
 * Not thread-safe on its own: every read-modify-write happens inside
 * {@code synchronized (session)}, and events are published before the
 * monitor is released so recipients observe commit order.
 */
@Getter
public class Session {

    private final String id;
    private final SessionType type;
    private final SessionPolicy policy;
    private final String title;
    private final String description;
    private final int maxParticipants;
    private final boolean isPrivate;
    private final String passwordDigest;
    private final Layout layout;
    private final Instant createdAt;

    @Setter private String hostId;
    @Setter private String roomCode;
    @Setter private SessionStatus status = SessionStatus.WAITING;
    @Setter private Instant startedAt;
    @Setter private Instant endedAt;
    @Setter private Instant lastActivityAt;
    @Setter private TurnState turnState;

    private final Map<String, Participant> participants = new LinkedHashMap<>();
    private final List<Message> messages = new ArrayList<>();
    private long nextJoinSequence;

    public Session(String id, SessionType type, SessionPolicy policy, String title, String description,
                   int maxParticipants, boolean isPrivate, String passwordDigest, Layout layout,
                   Instant createdAt) {
        this.id = id;
        this.type = type;
        this.policy = policy;
        this.title = title;
        this.description = description;
        this.maxParticipants = maxParticipants;
        this.isPrivate = isPrivate;
        this.passwordDigest = passwordDigest;
        this.layout = layout;
        this.createdAt = createdAt;
        this.lastActivityAt = createdAt;
    }

    public boolean isTerminal() {
        return status == SessionStatus.COMPLETE;
    }

    public boolean isFull() {
        return participants.size() >= maxParticipants;
    }

    public Optional<Participant> participant(String userId) {
        return Optional.ofNullable(participants.get(userId));
    }

    public boolean hasParticipant(String userId) {
        return participants.containsKey(userId);
    }

    public Collection<Participant> getParticipants() {
        return Collections.unmodifiableCollection(participants.values());
    }

    public int participantCount() {
        return participants.size();
    }

    public Participant addParticipant(UserIdentity identity, Role role, Instant at) {
        Participant p = Participant.builder()
                .userId(identity.userId())
                .displayName(identity.displayName())
                .zodiacSign(identity.zodiacSign())
                .role(role)
                .joinedAt(at)
                .joinSequence(nextJoinSequence++)
                .build();
        participants.put(p.getUserId(), p);
        return p;
    }

    public Optional<Participant> removeParticipant(String userId) {
        return Optional.ofNullable(participants.remove(userId));
    }

    /** Earliest-joined participant; insertion order is join order. */
    public Optional<Participant> earliestJoined() {
        return participants.values().stream().findFirst();
    }

    public List<Message> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public Optional<Message> message(String messageId) {
        return messages.stream().filter(m -> m.getId().equals(messageId)).findFirst();
    }

    public Optional<Message> lastMessage() {
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(messages.size() - 1));
    }

    public void appendMessage(Message message) {
        messages.add(message);
    }

    public void touch(Instant at) {
        this.lastActivityAt = at;
    }
}
