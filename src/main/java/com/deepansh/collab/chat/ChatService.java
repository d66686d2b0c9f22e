package com.deepansh.collab.chat;

import com.deepansh.collab.broadcast.BroadcastFanout;
import com.deepansh.collab.broadcast.ServerEvent;
import com.deepansh.collab.config.CollabProperties;
import com.deepansh.collab.exception.CollabException;
import com.deepansh.collab.exception.ErrorKind;
import com.deepansh.collab.model.Message;
import com.deepansh.collab.model.MessageType;
import com.deepansh.collab.model.Participant;
import com.deepansh.collab.model.Reaction;
import com.deepansh.collab.model.SendMessageRequest;
import com.deepansh.collab.model.Session;
import com.deepansh.collab.session.SessionGuards;
import com.deepansh.collab.session.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Threaded chat and reactions for a session.
 *
 * The log is append-only. Timestamps are strictly increasing per session,
 * so "reply only to an earlier message" is a plain timestamp comparison and
 * reply chains can never form a cycle.
 */
@Service
@Slf4j
public class ChatService {

    private final SessionRegistry sessionRegistry;
    private final BroadcastFanout fanout;
    private final TypingTracker typingTracker;
    private final ChatRateLimiter rateLimiter;
    private final CollabProperties properties;
    private final Clock clock;

    public ChatService(SessionRegistry sessionRegistry,
                       BroadcastFanout fanout,
                       TypingTracker typingTracker,
                       ChatRateLimiter rateLimiter,
                       CollabProperties properties,
                       Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.fanout = fanout;
        this.typingTracker = typingTracker;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
        this.clock = clock;
    }

    public Message postMessage(String userId, SendMessageRequest request) {
        String content = request.getContent() == null ? "" : request.getContent().trim();
        if (content.isEmpty()) {
            throw new CollabException(ErrorKind.EMPTY_MESSAGE, "Message content must not be empty");
        }
        int max = properties.getChat().getMaxContentLength();
        if (content.length() > max) {
            throw CollabException.badRequest("Message exceeds " + max + " characters");
        }
        MessageType type = request.getType() == null ? MessageType.TEXT : request.getType();
        if (type == MessageType.SYSTEM) {
            throw CollabException.unauthorized("System messages are reserved for the server");
        }

        Session session = sessionRegistry.require(request.getSessionId());
        synchronized (session) {
            SessionGuards.requireOpen(session);
            Participant author = SessionGuards.requireParticipant(session, userId);

            Instant timestamp = nextTimestamp(session);
            if (request.getReplyTo() != null && !request.getReplyTo().isBlank()) {
                Message parent = session.message(request.getReplyTo())
                        .orElseThrow(() -> new CollabException(ErrorKind.INVALID_REPLY,
                                "replyTo does not reference a message in this session"));
                if (!parent.getTimestamp().isBefore(timestamp)) {
                    throw new CollabException(ErrorKind.INVALID_REPLY, "Replies must target an earlier message");
                }
            }

            if (!rateLimiter.tryAcquire(session.getId(), userId)) {
                throw new CollabException(ErrorKind.RATE_LIMITED, "Too many messages, slow down");
            }

            Message message = Message.builder()
                    .id(UUID.randomUUID().toString())
                    .sessionId(session.getId())
                    .userId(userId)
                    .displayName(author.getDisplayName())
                    .content(content)
                    .timestamp(timestamp)
                    .type(type)
                    .replyTo(blankToNull(request.getReplyTo()))
                    .attachedEntityId(blankToNull(request.getAttachedEntityId()))
                    .build();

            session.appendMessage(message);
            session.touch(timestamp);
            typingTracker.clear(session, author);
            Message posted = message.copy();
            fanout.publish(session.getId(), ServerEvent.of(ServerEvent.MESSAGE, posted));

            log.debug("Message posted [sessionId={}, messageId={}, userId={}, replyTo={}]",
                    session.getId(), message.getId(), userId, message.getReplyTo());
            return posted;
        }
    }

    /**
     * @return true when the reaction was new; a repeated (user, symbol) pair changes nothing
     */
    public boolean addReaction(String sessionId, String messageId, String userId, String symbol, String label) {
        if (symbol == null || symbol.isBlank()) {
            throw CollabException.badRequest("symbol must not be blank");
        }
        Session session = sessionRegistry.require(sessionId);
        synchronized (session) {
            SessionGuards.requireOpen(session);
            SessionGuards.requireParticipant(session, userId);
            Message message = session.message(messageId)
                    .orElseThrow(() -> CollabException.notFound("Message", messageId));

            Reaction reaction = new Reaction(userId, symbol.trim(), blankToNull(label));
            if (!message.addReaction(reaction)) {
                return false;
            }
            session.touch(clock.instant());

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("sessionId", sessionId);
            payload.put("messageId", messageId);
            payload.put("reaction", reaction);
            fanout.publish(sessionId, ServerEvent.of(ServerEvent.REACTION_ADDED, payload));
            return true;
        }
    }

    /**
     * Append and broadcast a server-authored notice.
     * Caller holds the session monitor.
     */
    public Message appendSystemMessage(Session session, String content) {
        Message message = Message.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(session.getId())
                .userId("system")
                .displayName("Cosmos")
                .content(content)
                .timestamp(nextTimestamp(session))
                .type(MessageType.SYSTEM)
                .build();
        session.appendMessage(message);
        Message posted = message.copy();
        fanout.publish(session.getId(), ServerEvent.of(ServerEvent.MESSAGE, posted));
        return posted;
    }

    public List<Message> messages(String sessionId) {
        Session session = sessionRegistry.require(sessionId);
        synchronized (session) {
            return session.getMessages().stream().map(Message::copy).toList();
        }
    }

    private Instant nextTimestamp(Session session) {
        Instant now = clock.instant();
        return session.lastMessage()
                .map(Message::getTimestamp)
                .filter(last -> !now.isAfter(last))
                .map(last -> last.plusNanos(1_000))
                .orElse(now);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
