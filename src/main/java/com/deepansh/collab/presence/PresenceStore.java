package com.deepansh.collab.presence;

import com.deepansh.collab.broadcast.ClientChannel;
import com.deepansh.collab.broadcast.OutboundQueue;
import com.deepansh.collab.config.CollabProperties;
import com.deepansh.collab.model.UserIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Connection bookkeeping: identity, attachment and the live connection per user.
 *
 * Invariants:
 * - a connection is attached to at most one session; attaching elsewhere
 *   detaches it from the previous one
 * - a user has at most one current connection; a newer one supersedes the older
 */
@Component
@Slf4j
public class PresenceStore {

    private final Executor fanoutExecutor;
    private final CollabProperties properties;

    private final Map<String, ClientConnection> byConnectionId = new ConcurrentHashMap<>();
    private final Map<String, ClientConnection> currentByUser = new ConcurrentHashMap<>();
    private final Map<String, Set<ClientConnection>> attachedBySession = new ConcurrentHashMap<>();

    public PresenceStore(@Qualifier("fanoutTaskExecutor") Executor fanoutExecutor,
                         CollabProperties properties) {
        this.fanoutExecutor = fanoutExecutor;
        this.properties = properties;
    }

    /**
     * Register a freshly opened connection.
     *
     * @return the registration, carrying the superseded connection of the same user if any
     */
    public Registration register(UserIdentity identity, ClientChannel channel) {
        OutboundQueue queue = new OutboundQueue(channel, fanoutExecutor,
                properties.getFanout().getMaxPendingEvents());
        ClientConnection connection = new ClientConnection(identity, channel, queue);

        byConnectionId.put(connection.id(), connection);
        ClientConnection previous = currentByUser.put(identity.userId(), connection);

        log.info("Connection registered [connection={}, userId={}, replaced={}]",
                connection.id(), identity.userId(), previous != null ? previous.id() : null);
        return new Registration(connection, Optional.ofNullable(previous));
    }

    /**
     * Forget a connection after its transport closed.
     *
     * @return true when it was still the user's current connection
     */
    public boolean unregister(ClientConnection connection) {
        byConnectionId.remove(connection.id());
        detach(connection);
        boolean wasCurrent = currentByUser.remove(connection.userId(), connection);
        log.info("Connection unregistered [connection={}, userId={}, wasCurrent={}]",
                connection.id(), connection.userId(), wasCurrent);
        return wasCurrent;
    }

    /**
     * Attach to a session, detaching from any other first.
     *
     * @return the session the connection was attached to before, if different
     */
    public Optional<String> attach(ClientConnection connection, String sessionId) {
        synchronized (connection) {
            Optional<String> previous = connection.attachedSessionId()
                    .filter(prev -> !prev.equals(sessionId));
            previous.ifPresent(prev -> removeFromSession(prev, connection));

            connection.setAttachedSessionId(sessionId);
            attachedBySession.computeIfAbsent(sessionId, k -> ConcurrentHashMap.newKeySet()).add(connection);
            return previous;
        }
    }

    public void detach(ClientConnection connection) {
        synchronized (connection) {
            connection.attachedSessionId().ifPresent(sid -> removeFromSession(sid, connection));
            connection.setAttachedSessionId(null);
        }
    }

    /** Detach the user's current connection, if it is attached to this session. */
    public void detachUser(String userId, String sessionId) {
        current(userId)
                .filter(c -> c.attachedSessionId().map(sessionId::equals).orElse(false))
                .ifPresent(this::detach);
    }

    public Optional<ClientConnection> current(String userId) {
        return Optional.ofNullable(currentByUser.get(userId));
    }

    public Optional<ClientConnection> byId(String connectionId) {
        return Optional.ofNullable(byConnectionId.get(connectionId));
    }

    public List<ClientConnection> attached(String sessionId) {
        Set<ClientConnection> set = attachedBySession.get(sessionId);
        return set == null ? List.of() : List.copyOf(set);
    }

    public int attachedCount(String sessionId) {
        Set<ClientConnection> set = attachedBySession.get(sessionId);
        return set == null ? 0 : set.size();
    }

    public boolean isOnline(String userId) {
        return current(userId).map(ClientConnection::isOpen).orElse(false);
    }

    public int connectionCount() {
        return byConnectionId.size();
    }

    private void removeFromSession(String sessionId, ClientConnection connection) {
        attachedBySession.computeIfPresent(sessionId, (k, set) -> {
            set.remove(connection);
            return set.isEmpty() ? null : set;
        });
    }

    public record Registration(ClientConnection connection, Optional<ClientConnection> superseded) {
    }
}
