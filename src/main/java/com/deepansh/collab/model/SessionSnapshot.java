package com.deepansh.collab.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of a session, taken under the session monitor and safe to
 * serialize on any thread. Sent as {@code session_state}.
 */
public record SessionSnapshot(
        String id,
        SessionType type,
        String title,
        String description,
        String hostId,
        int maxParticipants,
        @JsonProperty("isPrivate") boolean isPrivate,
        String roomCode,
        SessionStatus status,
        Instant createdAt,
        Instant startedAt,
        Instant endedAt,
        String layout,
        List<ParticipantView> participants,
        TurnView turn,
        List<Message> messages
) {

    public static SessionSnapshot of(Session s, int messageLimit) {
        List<ParticipantView> participants = s.getParticipants().stream()
                .map(ParticipantView::of)
                .toList();

        List<Message> all = s.getMessages();
        List<Message> recent = all.subList(Math.max(0, all.size() - messageLimit), all.size()).stream()
                .map(Message::copy)
                .toList();

        return new SessionSnapshot(
                s.getId(), s.getType(), s.getTitle(), s.getDescription(), s.getHostId(),
                s.getMaxParticipants(), s.isPrivate(),
                s.isTerminal() ? null : s.getRoomCode(),
                s.getStatus(), s.getCreatedAt(), s.getStartedAt(), s.getEndedAt(),
                s.getLayout() != null ? s.getLayout().name() : null,
                participants,
                s.getTurnState() != null ? TurnView.of(s.getTurnState()) : null,
                recent);
    }

    /** Listing row without participants or messages. */
    public Summary summary() {
        String hostName = participants.stream()
                .filter(p -> p.userId().equals(hostId))
                .map(ParticipantView::displayName)
                .findFirst()
                .orElse(null);
        long online = participants.stream().filter(ParticipantView::online).count();
        return new Summary(id, type, title, description, status, participants.size(),
                (int) online, maxParticipants, isPrivate, roomCode, hostName, createdAt);
    }

    public record ParticipantView(
            String userId,
            String displayName,
            String zodiacSign,
            Role role,
            boolean online,
            CursorPosition cursor,
            VoiceState voiceState,
            Instant joinedAt
    ) {
        public static ParticipantView of(Participant p) {
            return new ParticipantView(p.getUserId(), p.getDisplayName(), p.getZodiacSign(),
                    p.getRole(), p.isOnline(), p.getCursor(), p.getVoiceState(), p.getJoinedAt());
        }
    }

    public record TurnView(
            List<String> turnOrder,
            int currentTurnIndex,
            String currentUserId,
            List<ResourceView> resources
    ) {
        public static TurnView of(TurnState t) {
            return new TurnView(List.copyOf(t.getTurnOrder()), t.getCurrentTurnIndex(),
                    t.currentUserId().orElse(null),
                    t.getResources().stream().map(ResourceView::of).toList());
        }
    }

    /** Orientation stays hidden until the resource is revealed. */
    public record ResourceView(
            String id,
            String position,
            String label,
            boolean revealed,
            Orientation orientation,
            String revealedBy,
            Instant revealedAt
    ) {
        public static ResourceView of(TurnResource r) {
            return new ResourceView(r.getId(), r.getPosition(), r.getLabel(), r.isRevealed(),
                    r.isRevealed() ? r.getOrientation() : null, r.getRevealedBy(), r.getRevealedAt());
        }
    }

    public record Summary(
            String id,
            SessionType type,
            String title,
            String description,
            SessionStatus status,
            int participantCount,
            int onlineCount,
            int maxParticipants,
            @JsonProperty("isPrivate") boolean isPrivate,
            String roomCode,
            String hostDisplayName,
            Instant createdAt
    ) {
    }
}
