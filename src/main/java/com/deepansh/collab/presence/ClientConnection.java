package com.deepansh.collab.presence;

import com.deepansh.collab.broadcast.ClientChannel;
import com.deepansh.collab.broadcast.OutboundQueue;
import com.deepansh.collab.broadcast.ServerEvent;
import com.deepansh.collab.model.UserIdentity;

import java.util.Optional;

/**
 * Per-connection session handle: who is on the other end, which session
 * (at most one) they are attached to, and their outbound mailbox.
 */
public class ClientConnection {

    private final UserIdentity identity;
    private final ClientChannel channel;
    private final OutboundQueue outbound;
    private volatile String attachedSessionId;

    ClientConnection(UserIdentity identity, ClientChannel channel, OutboundQueue outbound) {
        this.identity = identity;
        this.channel = channel;
        this.outbound = outbound;
    }

    public String id() {
        return channel.id();
    }

    public UserIdentity identity() {
        return identity;
    }

    public String userId() {
        return identity.userId();
    }

    public Optional<String> attachedSessionId() {
        return Optional.ofNullable(attachedSessionId);
    }

    void setAttachedSessionId(String sessionId) {
        this.attachedSessionId = sessionId;
    }

    public boolean send(ServerEvent event) {
        return outbound.enqueue(event);
    }

    public boolean isOpen() {
        return !outbound.isClosed() && channel.isOpen();
    }

    public void close(String reason) {
        outbound.close(reason);
    }

    @Override
    public String toString() {
        return "ClientConnection[" + id() + ", user=" + userId() + ", session=" + attachedSessionId + "]";
    }
}
