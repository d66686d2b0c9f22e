package com.deepansh.collab.chat;

import com.deepansh.collab.broadcast.BroadcastFanout;
import com.deepansh.collab.broadcast.ServerEvent;
import com.deepansh.collab.config.CollabProperties;
import com.deepansh.collab.model.Participant;
import com.deepansh.collab.model.Session;
import com.deepansh.collab.session.SessionGuards;
import com.deepansh.collab.session.SessionLifecycleListener;
import com.deepansh.collab.session.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Ephemeral "is typing" indicators. Nothing is persisted; every indicator
 * expires on its own so a client that dies mid-sentence leaves no ghost.
 */
@Component
@Slf4j
public class TypingTracker implements SessionLifecycleListener {

    private final SessionRegistry sessionRegistry;
    private final BroadcastFanout fanout;
    private final TaskScheduler scheduler;
    private final CollabProperties properties;
    private final Clock clock;

    private final Map<String, ScheduledFuture<?>> expiries = new ConcurrentHashMap<>();

    public TypingTracker(SessionRegistry sessionRegistry,
                         BroadcastFanout fanout,
                         @Qualifier("collabTaskScheduler") TaskScheduler scheduler,
                         CollabProperties properties,
                         Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.fanout = fanout;
        this.scheduler = scheduler;
        this.properties = properties;
        this.clock = clock;
    }

    public void startTyping(String sessionId, String userId) {
        Session session = sessionRegistry.require(sessionId);
        synchronized (session) {
            SessionGuards.requireOpen(session);
            Participant typist = SessionGuards.requireParticipant(session, userId);

            String key = key(sessionId, userId);
            ScheduledFuture<?> expiry = scheduler.schedule(() -> expire(sessionId, userId),
                    clock.instant().plus(properties.getChat().getTypingTimeout()));
            ScheduledFuture<?> previous = expiries.put(key, expiry);

            if (previous != null) {
                previous.cancel(false);
                return;
            }
            fanout.publishExcept(sessionId, typingEvent(ServerEvent.TYPING_START, sessionId, typist), userId);
        }
    }

    public void stopTyping(String sessionId, String userId) {
        Session session = sessionRegistry.require(sessionId);
        synchronized (session) {
            SessionGuards.requireOpen(session);
            Participant typist = SessionGuards.requireParticipant(session, userId);
            clear(session, typist);
        }
    }

    /**
     * Clear the indicator, e.g. because the user just sent the message.
     * Caller holds the session monitor.
     */
    void clear(Session session, Participant typist) {
        ScheduledFuture<?> expiry = expiries.remove(key(session.getId(), typist.getUserId()));
        if (expiry != null) {
            expiry.cancel(false);
            fanout.publishExcept(session.getId(),
                    typingEvent(ServerEvent.TYPING_STOP, session.getId(), typist), typist.getUserId());
        }
    }

    public boolean isTyping(String sessionId, String userId) {
        return expiries.containsKey(key(sessionId, userId));
    }

    private void expire(String sessionId, String userId) {
        sessionRegistry.find(sessionId).ifPresent(session -> {
            synchronized (session) {
                if (expiries.remove(key(sessionId, userId)) == null) return;
                session.participant(userId).ifPresent(p -> {
                    log.debug("Typing indicator expired [sessionId={}, userId={}]", sessionId, userId);
                    fanout.publishExcept(sessionId, typingEvent(ServerEvent.TYPING_STOP, sessionId, p), userId);
                });
            }
        });
    }

    @Override
    public void onParticipantRemoved(Session session, String userId) {
        cancel(key(session.getId(), userId));
    }

    @Override
    public void onSessionClosed(Session session) {
        onSessionPurged(session.getId());
    }

    @Override
    public void onSessionPurged(String sessionId) {
        String prefix = sessionId + "|";
        expiries.keySet().stream()
                .filter(k -> k.startsWith(prefix))
                .toList()
                .forEach(this::cancel);
    }

    private void cancel(String key) {
        ScheduledFuture<?> expiry = expiries.remove(key);
        if (expiry != null) expiry.cancel(false);
    }

    private static ServerEvent typingEvent(String event, String sessionId, Participant p) {
        return ServerEvent.of(event, Map.of(
                "sessionId", sessionId,
                "userId", p.getUserId(),
                "displayName", p.getDisplayName()));
    }

    private static String key(String sessionId, String userId) {
        return sessionId + "|" + userId;
    }
}
