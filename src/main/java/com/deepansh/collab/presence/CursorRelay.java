package com.deepansh.collab.presence;

import com.deepansh.collab.broadcast.BroadcastFanout;
import com.deepansh.collab.broadcast.ServerEvent;
import com.deepansh.collab.config.CollabProperties;
import com.deepansh.collab.model.CursorPosition;
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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Relays cursor positions with a trailing-edge throttle per (session, user).
 *
 * The first sample in a window opens it and schedules a flush one throttle
 * interval later; samples arriving inside the window only overwrite the
 * stored position. The flush broadcasts whatever is stored then, so at most
 * one cursor_update per window goes out and it always carries the latest
 * sample. Excess samples are coalesced, never rejected.
 */
@Component
@Slf4j
public class CursorRelay implements SessionLifecycleListener {

    private final SessionRegistry sessionRegistry;
    private final BroadcastFanout fanout;
    private final TaskScheduler scheduler;
    private final CollabProperties properties;
    private final Clock clock;

    private final Map<String, ScheduledFuture<?>> openWindows = new ConcurrentHashMap<>();

    public CursorRelay(SessionRegistry sessionRegistry,
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

    /**
     * Record a cursor sample. Coordinates are clamped to [0, 100].
     *
     * @return the stored (clamped) position
     */
    public CursorPosition updateCursor(String sessionId, String userId, double x, double y, String element) {
        Session session = sessionRegistry.require(sessionId);
        synchronized (session) {
            SessionGuards.requireOpen(session);
            Participant participant = SessionGuards.requireParticipant(session, userId);

            CursorPosition position = CursorPosition.clamped(x, y, element);
            participant.setCursor(position);
            session.touch(clock.instant());

            String key = key(sessionId, userId);
            if (!openWindows.containsKey(key)) {
                ScheduledFuture<?> flush = scheduler.schedule(() -> flush(sessionId, userId),
                        clock.instant().plus(properties.getPresence().getCursorThrottle()));
                openWindows.put(key, flush);
            }
            return position;
        }
    }

    public boolean hasPendingFlush(String sessionId, String userId) {
        return openWindows.containsKey(key(sessionId, userId));
    }

    private void flush(String sessionId, String userId) {
        sessionRegistry.find(sessionId).ifPresent(session -> {
            synchronized (session) {
                if (openWindows.remove(key(sessionId, userId)) == null) return;
                if (session.isTerminal()) return;
                session.participant(userId)
                        .filter(p -> p.getCursor() != null)
                        .ifPresent(p -> {
                            String excluded = properties.getPresence().isExcludeCursorOriginator() ? userId : null;
                            fanout.publishExcept(sessionId, cursorEvent(sessionId, p), excluded);
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
        openWindows.keySet().stream()
                .filter(k -> k.startsWith(prefix))
                .toList()
                .forEach(this::cancel);
    }

    private void cancel(String key) {
        ScheduledFuture<?> flush = openWindows.remove(key);
        if (flush != null) flush.cancel(false);
    }

    private static ServerEvent cursorEvent(String sessionId, Participant p) {
        CursorPosition c = p.getCursor();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", sessionId);
        payload.put("userId", p.getUserId());
        payload.put("displayName", p.getDisplayName());
        payload.put("x", c.x());
        payload.put("y", c.y());
        payload.put("element", c.element());
        return ServerEvent.of(ServerEvent.CURSOR_UPDATE, payload);
    }

    private static String key(String sessionId, String userId) {
        return sessionId + "|" + userId;
    }
}
