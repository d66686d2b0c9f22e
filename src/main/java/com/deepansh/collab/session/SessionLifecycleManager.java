package com.deepansh.collab.session;

import com.deepansh.collab.broadcast.BroadcastFanout;
import com.deepansh.collab.broadcast.ServerEvent;
import com.deepansh.collab.chat.ChatService;
import com.deepansh.collab.config.CollabProperties;
import com.deepansh.collab.exception.CollabException;
import com.deepansh.collab.exception.ErrorKind;
import com.deepansh.collab.model.CreateSessionRequest;
import com.deepansh.collab.model.Layout;
import com.deepansh.collab.model.Participant;
import com.deepansh.collab.model.Role;
import com.deepansh.collab.model.Session;
import com.deepansh.collab.model.SessionPolicy;
import com.deepansh.collab.model.SessionSnapshot;
import com.deepansh.collab.model.SessionStatus;
import com.deepansh.collab.model.UserIdentity;
import com.deepansh.collab.presence.ClientConnection;
import com.deepansh.collab.presence.PresenceStore;
import com.deepansh.collab.room.RoomDirectory;
import com.deepansh.collab.turn.LayoutCatalog;
import com.deepansh.collab.turn.TurnCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Creates, joins, leaves and transitions sessions.
 *
 * State machine: waiting --start(host)--> active --end(host) | last leave | idle--> complete.
 * Complete is terminal; the session stays readable for attached clients until
 * they detach or the retention window passes, then it is purged.
 *
 * Every operation validates first and mutates second, inside
 * {@code synchronized (session)}, and publishes its events before releasing
 * the monitor. Work that touches a second session (leaving the previously
 * attached one) happens after the monitor is released, so no thread ever
 * holds two session monitors.
 */
@Service
@Slf4j
public class SessionLifecycleManager {

    private final SessionRegistry sessionRegistry;
    private final RoomDirectory roomDirectory;
    private final PresenceStore presenceStore;
    private final BroadcastFanout fanout;
    private final TurnCoordinator turnCoordinator;
    private final ChatService chatService;
    private final SessionPolicies policies;
    private final LayoutCatalog layoutCatalog;
    private final TaskScheduler scheduler;
    private final CollabProperties properties;
    private final Clock clock;
    private final List<SessionLifecycleListener> listeners;

    /** userId → seat held open for a dropped connection. */
    private final Map<String, PendingLeave> pendingLeaves = new ConcurrentHashMap<>();

    public SessionLifecycleManager(SessionRegistry sessionRegistry,
                                   RoomDirectory roomDirectory,
                                   PresenceStore presenceStore,
                                   BroadcastFanout fanout,
                                   TurnCoordinator turnCoordinator,
                                   ChatService chatService,
                                   SessionPolicies policies,
                                   LayoutCatalog layoutCatalog,
                                   @Qualifier("collabTaskScheduler") TaskScheduler scheduler,
                                   CollabProperties properties,
                                   Clock clock,
                                   List<SessionLifecycleListener> listeners) {
        this.sessionRegistry = sessionRegistry;
        this.roomDirectory = roomDirectory;
        this.presenceStore = presenceStore;
        this.fanout = fanout;
        this.turnCoordinator = turnCoordinator;
        this.chatService = chatService;
        this.policies = policies;
        this.layoutCatalog = layoutCatalog;
        this.scheduler = scheduler;
        this.properties = properties;
        this.clock = clock;
        this.listeners = List.copyOf(listeners);
    }

    // ─── Create / join / leave ───────────────────────────────────────────────

    /**
     * @param connection creator's connection to attach, or null for REST callers
     */
    public SessionSnapshot createSession(UserIdentity host, CreateSessionRequest request, ClientConnection connection) {
        if (request.getType() == null) {
            throw CollabException.invalidConfig("type is required");
        }
        if (request.getTitle() == null || request.getTitle().isBlank()) {
            throw CollabException.invalidConfig("title must not be blank");
        }
        SessionPolicy policy = policies.policyFor(request.getType());
        Integer max = request.getMaxParticipants();
        if (max == null || !policy.acceptsCapacity(max)) {
            throw CollabException.invalidConfig(String.format(
                    "maxParticipants for %s must be between %d and %d",
                    request.getType().wireName(), policy.minParticipants(), policy.maxParticipants()));
        }
        if (request.privateSession() && (request.getPassword() == null || request.getPassword().isBlank())) {
            throw CollabException.invalidConfig("Private sessions need a password");
        }
        Layout layout = resolveLayout(request.getLayout(), policy);

        Instant now = clock.instant();
        String sessionId = UUID.randomUUID().toString();
        Session session = new Session(sessionId, request.getType(), policy, request.getTitle().trim(),
                request.getDescription() == null ? "" : request.getDescription().trim(),
                max, request.privateSession(),
                request.privateSession() ? PasswordDigests.digest(request.getPassword()) : null,
                layout, now);

        Optional<String> previous = Optional.empty();
        SessionSnapshot snapshot;
        synchronized (session) {
            session.setRoomCode(roomDirectory.allocate(sessionId));
            session.addParticipant(host, Role.HOST, now);
            session.setHostId(host.userId());
            sessionRegistry.put(session);

            snapshot = snapshotOf(session);
            if (connection != null) {
                previous = presenceStore.attach(connection, sessionId);
                fanout.sendTo(connection, ServerEvent.of(ServerEvent.SESSION_CREATED, Map.of(
                        "sessionId", sessionId,
                        "roomCode", snapshot.roomCode(),
                        "type", request.getType())));
                fanout.sendTo(connection, ServerEvent.of(ServerEvent.SESSION_STATE, snapshot));
            }
        }

        log.info("Session created [sessionId={}, type={}, host={}, roomCode={}, max={}, private={}]",
                sessionId, request.getType().wireName(), host.userId(), snapshot.roomCode(), max,
                request.privateSession());

        previous.ifPresent(prev -> leaveSession(prev, host.userId()));
        return snapshot;
    }

    /**
     * Join by room code or session id. Either everything commits (seat,
     * attachment, broadcasts) or nothing does.
     */
    public SessionSnapshot joinSession(String sessionIdOrCode, UserIdentity identity, String password,
                                       ClientConnection connection) {
        Session session = sessionRegistry.resolve(sessionIdOrCode);
        String userId = identity.userId();

        Optional<String> previous = Optional.empty();
        SessionSnapshot snapshot;
        synchronized (session) {
            SessionGuards.requireOpen(session);
            Instant now = clock.instant();

            Optional<Participant> existing = session.participant(userId);
            if (existing.isPresent()) {
                cancelPendingLeave(userId, session.getId());
                existing.get().setOnline(true);
                session.touch(now);
                snapshot = snapshotOf(session);
                if (connection != null) {
                    previous = presenceStore.attach(connection, session.getId());
                    fanout.sendTo(connection, ServerEvent.of(ServerEvent.SESSION_STATE, snapshot));
                }
                log.info("Participant rejoined [sessionId={}, userId={}]", session.getId(), userId);
            } else {
                if (session.getStatus() == SessionStatus.ACTIVE && session.getPolicy().closedToJoinsWhenActive()) {
                    throw new CollabException(ErrorKind.CLOSED_TO_JOINS,
                            "This " + session.getType().wireName() + " has already started");
                }
                if (session.isPrivate() && !PasswordDigests.matches(password, session.getPasswordDigest())) {
                    throw new CollabException(ErrorKind.PRIVATE_AUTH_FAILED, "Incorrect session password");
                }
                if (session.isFull()) {
                    throw new CollabException(ErrorKind.FULL,
                            "Session is full (" + session.getMaxParticipants() + " participants)");
                }

                Participant joined = session.addParticipant(identity, Role.MEMBER, now);
                turnCoordinator.onParticipantJoined(session, userId);
                session.touch(now);

                fanout.publish(session.getId(), presenceEvent(session, "joined", joined));

                snapshot = snapshotOf(session);
                if (connection != null) {
                    previous = presenceStore.attach(connection, session.getId());
                    fanout.sendTo(connection, ServerEvent.of(ServerEvent.SESSION_STATE, snapshot));
                }
                chatService.appendSystemMessage(session, joined.getDisplayName() + " joined the session");

                log.info("Participant joined [sessionId={}, userId={}, count={}/{}]",
                        session.getId(), userId, session.participantCount(), session.getMaxParticipants());
            }
        }

        previous.ifPresent(prev -> leaveSession(prev, userId));
        return snapshot;
    }

    /**
     * Leave a session. Idempotent: unknown sessions and non-members are ignored.
     */
    public void leaveSession(String sessionId, String userId) {
        Optional<Session> found = sessionRegistry.find(sessionId);
        if (found.isEmpty()) return;
        Session session = found.get();
        cancelPendingLeave(userId, sessionId);

        synchronized (session) {
            presenceStore.detachUser(userId, sessionId);
            if (session.isTerminal()) {
                log.debug("Detached from completed session [sessionId={}, userId={}]", sessionId, userId);
            } else {
                session.removeParticipant(userId).ifPresent(left -> removeSeat(session, left));
            }
        }
        purgeIfDrained(session);
    }

    // ─── Transitions ─────────────────────────────────────────────────────────

    public SessionSnapshot startSession(String sessionId, String userId) {
        Session session = sessionRegistry.require(sessionId);
        synchronized (session) {
            SessionGuards.requireOpen(session);
            SessionGuards.requireHost(session, userId);
            if (session.getStatus() != SessionStatus.WAITING) {
                throw CollabException.invalidTransition("Session can only be started while waiting");
            }

            Instant now = clock.instant();
            session.setStatus(SessionStatus.ACTIVE);
            session.setStartedAt(now);
            session.touch(now);
            turnCoordinator.initialize(session);

            fanout.publish(sessionId, statusEvent(session, "started"));
            turnCoordinator.publishTurn(session);
            chatService.appendSystemMessage(session, "The session has begun");

            log.info("Session started [sessionId={}, participants={}]", sessionId, session.participantCount());
            return snapshotOf(session);
        }
    }

    public void endSession(String sessionId, String userId) {
        Session session = sessionRegistry.require(sessionId);
        synchronized (session) {
            SessionGuards.requireOpen(session);
            SessionGuards.requireHost(session, userId);
            chatService.appendSystemMessage(session, "The host ended the session");
            complete(session, "ended");
        }
        purgeIfDrained(session);
    }

    // ─── Queries ─────────────────────────────────────────────────────────────

    public SessionSnapshot snapshot(String sessionId) {
        Session session = sessionRegistry.require(sessionId);
        synchronized (session) {
            return snapshotOf(session);
        }
    }

    /**
     * Snapshot for a specific caller. Private sessions are visible to members only.
     */
    public SessionSnapshot snapshotFor(String sessionId, String userId) {
        Session session = sessionRegistry.require(sessionId);
        synchronized (session) {
            if (session.isPrivate() && (userId == null || !session.hasParticipant(userId))) {
                throw CollabException.unauthorized("Private session");
            }
            return snapshotOf(session);
        }
    }

    /**
     * Non-terminal sessions visible to the caller: every public one plus the
     * private ones they sit in. Newest first.
     */
    public List<SessionSnapshot.Summary> listSessions(String userId) {
        return sessionRegistry.all().stream()
                .map(session -> {
                    synchronized (session) {
                        if (session.isTerminal()) return null;
                        if (session.isPrivate() && (userId == null || !session.hasParticipant(userId))) return null;
                        return snapshotOf(session).summary();
                    }
                })
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(SessionSnapshot.Summary::createdAt).reversed())
                .toList();
    }

    // ─── Connections ─────────────────────────────────────────────────────────

    /**
     * Reattach a returning user: either their newer connection supersedes a
     * still-open one, or they came back inside the grace window.
     */
    public void onConnected(PresenceStore.Registration registration) {
        ClientConnection connection = registration.connection();
        String userId = connection.userId();

        Optional<String> sessionId = registration.superseded()
                .flatMap(old -> {
                    Optional<String> attached = old.attachedSessionId();
                    presenceStore.detach(old);
                    old.close("superseded by a newer connection");
                    return attached;
                })
                .or(() -> Optional.ofNullable(pendingLeaves.remove(userId))
                        .map(pending -> {
                            pending.cancel();
                            return pending.sessionId();
                        }));

        sessionId.flatMap(sessionRegistry::find).ifPresent(session -> {
            synchronized (session) {
                if (session.isTerminal()) return;
                session.participant(userId).ifPresent(p -> {
                    p.setOnline(true);
                    presenceStore.attach(connection, session.getId());
                    fanout.sendTo(connection, ServerEvent.of(ServerEvent.SESSION_STATE, snapshotOf(session)));
                    log.info("Connection resumed seat [sessionId={}, userId={}]", session.getId(), userId);
                });
            }
        });
    }

    /**
     * A dropped connection keeps its seat for the grace window. Nothing is
     * broadcast until the window runs out and the seat is released.
     */
    public void onDisconnected(ClientConnection connection) {
        Optional<String> attached = connection.attachedSessionId();
        boolean wasCurrent = presenceStore.unregister(connection);
        if (!wasCurrent || attached.isEmpty()) return;

        String userId = connection.userId();
        sessionRegistry.find(attached.get()).ifPresent(session -> {
            synchronized (session) {
                if (!session.isTerminal()) {
                    session.participant(userId).ifPresent(p -> {
                        p.setOnline(false);
                        scheduleGraceExpiry(session.getId(), userId);
                    });
                }
            }
            purgeIfDrained(session);
        });
    }

    public boolean hasPendingLeave(String userId) {
        return pendingLeaves.containsKey(userId);
    }

    // ─── Housekeeping ────────────────────────────────────────────────────────

    /** Complete sessions nobody has touched for the idle timeout. */
    public int expireIdleSessions() {
        Instant cutoff = clock.instant().minus(properties.getSessions().getIdleTimeout());
        int expired = 0;
        for (Session session : sessionRegistry.all()) {
            boolean completed = false;
            synchronized (session) {
                if (!session.isTerminal() && session.getLastActivityAt().isBefore(cutoff)) {
                    complete(session, "idle");
                    completed = true;
                }
            }
            if (completed) {
                expired++;
                purgeIfDrained(session);
            }
        }
        return expired;
    }

    /** Purge completed sessions past retention, even if clients are still attached. */
    public int purgeRetired() {
        Instant cutoff = clock.instant().minus(properties.getSessions().getRetention());
        int purged = 0;
        for (Session session : sessionRegistry.all()) {
            boolean retired;
            synchronized (session) {
                retired = session.isTerminal() && session.getEndedAt().isBefore(cutoff);
            }
            if (retired) {
                purge(session.getId());
                purged++;
            }
        }
        return purged;
    }

    // ─── Internals ───────────────────────────────────────────────────────────

    /** Caller holds the session monitor and has already removed the seat. */
    private void removeSeat(Session session, Participant left) {
        String sessionId = session.getId();
        listeners.forEach(l -> l.onParticipantRemoved(session, left.getUserId()));

        if (session.participantCount() == 0) {
            turnCoordinator.onParticipantLeft(session, left.getUserId());
            log.info("Last participant left [sessionId={}, userId={}]", sessionId, left.getUserId());
            complete(session, "empty");
            return;
        }

        Participant newHost = null;
        if (left.isHost()) {
            newHost = session.earliestJoined().orElseThrow();
            newHost.setRole(Role.HOST);
            session.setHostId(newHost.getUserId());
        }
        session.touch(clock.instant());

        fanout.publish(sessionId, presenceEvent(session, "left", left));
        turnCoordinator.onParticipantLeft(session, left.getUserId());
        chatService.appendSystemMessage(session, left.getDisplayName() + " left the session");

        if (newHost != null) {
            chatService.appendSystemMessage(session, newHost.getDisplayName() + " is now the host");
            log.info("Host transferred [sessionId={}, from={}, to={}]", sessionId, left.getUserId(), newHost.getUserId());
        }
        log.info("Participant left [sessionId={}, userId={}, remaining={}]",
                sessionId, left.getUserId(), session.participantCount());
    }

    /** Caller holds the session monitor. */
    private void complete(Session session, String reason) {
        Instant now = clock.instant();
        session.setStatus(SessionStatus.COMPLETE);
        session.setEndedAt(now);
        roomDirectory.release(session.getRoomCode());
        listeners.forEach(l -> l.onSessionClosed(session));
        fanout.publish(session.getId(), statusEvent(session, reason));
        log.info("Session complete [sessionId={}, reason={}]", session.getId(), reason);
    }

    private void purgeIfDrained(Session session) {
        boolean drained;
        synchronized (session) {
            drained = session.isTerminal() && presenceStore.attachedCount(session.getId()) == 0;
        }
        if (drained) {
            purge(session.getId());
        }
    }

    private void purge(String sessionId) {
        sessionRegistry.remove(sessionId).ifPresent(session -> {
            presenceStore.attached(sessionId).forEach(presenceStore::detach);
            pendingLeaves.entrySet().removeIf(e -> {
                if (!e.getValue().sessionId().equals(sessionId)) return false;
                e.getValue().cancel();
                return true;
            });
            listeners.forEach(l -> l.onSessionPurged(sessionId));
            log.info("Session purged [sessionId={}]", sessionId);
        });
    }

    private void scheduleGraceExpiry(String sessionId, String userId) {
        Instant deadline = clock.instant().plus(properties.getPresence().getGraceWindow());
        // Registered before scheduling so a task due immediately still finds its own entry.
        PendingLeave pending = new PendingLeave(sessionId);
        PendingLeave replaced = pendingLeaves.put(userId, pending);
        if (replaced != null) replaced.cancel();

        pending.setFuture(scheduler.schedule(() -> {
            if (pendingLeaves.remove(userId, pending)) {
                log.info("Grace window elapsed, releasing seat [sessionId={}, userId={}]", sessionId, userId);
                leaveSession(sessionId, userId);
            }
        }, deadline));
        log.info("Connection dropped, seat held [sessionId={}, userId={}, until={}]", sessionId, userId, deadline);
    }

    private void cancelPendingLeave(String userId, String sessionId) {
        PendingLeave pending = pendingLeaves.get(userId);
        if (pending != null && pending.sessionId().equals(sessionId) && pendingLeaves.remove(userId, pending)) {
            pending.cancel();
        }
    }

    private Layout resolveLayout(String requested, SessionPolicy policy) {
        if (requested != null && !requested.isBlank()) {
            return layoutCatalog.find(requested)
                    .orElseThrow(() -> CollabException.invalidConfig("Unknown layout: " + requested));
        }
        if (policy.defaultLayout() == null) return null;
        return layoutCatalog.find(policy.defaultLayout())
                .orElseThrow(() -> new IllegalStateException("Default layout missing: " + policy.defaultLayout()));
    }

    private SessionSnapshot snapshotOf(Session session) {
        return SessionSnapshot.of(session, properties.getSessions().getSnapshotMessageLimit());
    }

    private ServerEvent presenceEvent(Session session, String change, Participant subject) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", session.getId());
        payload.put("change", change);
        payload.put("participant", SessionSnapshot.ParticipantView.of(subject));
        payload.put("hostId", session.getHostId());
        payload.put("participantCount", session.participantCount());
        return ServerEvent.of(ServerEvent.PRESENCE_UPDATE, payload);
    }

    private ServerEvent statusEvent(Session session, String reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", session.getId());
        payload.put("status", session.getStatus());
        payload.put("reason", reason);
        payload.put("startedAt", session.getStartedAt());
        payload.put("endedAt", session.getEndedAt());
        return ServerEvent.of(ServerEvent.SESSION_STATUS, payload);
    }

    /** Seat held for a dropped connection. The future is set once the expiry is scheduled. */
    private static final class PendingLeave {
        private final String sessionId;
        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;

        PendingLeave(String sessionId) {
            this.sessionId = sessionId;
        }

        String sessionId() {
            return sessionId;
        }

        void setFuture(ScheduledFuture<?> future) {
            this.future = future;
            if (cancelled) future.cancel(false);
        }

        void cancel() {
            cancelled = true;
            ScheduledFuture<?> f = future;
            if (f != null) f.cancel(false);
        }
    }
}
