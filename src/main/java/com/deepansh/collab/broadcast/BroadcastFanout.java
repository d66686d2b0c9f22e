package com.deepansh.collab.broadcast;

import com.deepansh.collab.presence.ClientConnection;
import com.deepansh.collab.presence.PresenceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Delivers state deltas to every connection attached to a session.
 *
 * Callers publish while holding the session monitor. Enqueueing is
 * non-blocking, so the monitor is never held across network I/O, and every
 * recipient's mailbox receives the session's events in commit order.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BroadcastFanout {

    private final PresenceStore presenceStore;

    public int publish(String sessionId, ServerEvent event) {
        return publishExcept(sessionId, event, null);
    }

    /**
     * @param excludedUserId recipient to skip, typically the originator; may be null
     * @return number of mailboxes that accepted the event
     */
    public int publishExcept(String sessionId, ServerEvent event, String excludedUserId) {
        List<ClientConnection> recipients = presenceStore.attached(sessionId);
        int delivered = 0;
        for (ClientConnection connection : recipients) {
            if (excludedUserId != null && excludedUserId.equals(connection.userId())) continue;
            if (connection.send(event)) delivered++;
        }
        log.debug("Fan-out [sessionId={}, event={}, recipients={}]", sessionId, event.event(), delivered);
        return delivered;
    }

    public boolean sendTo(ClientConnection connection, ServerEvent event) {
        return connection != null && connection.send(event);
    }

    public boolean sendToUser(String userId, ServerEvent event) {
        return presenceStore.current(userId).map(c -> c.send(event)).orElse(false);
    }
}
