package com.deepansh.collab.broadcast;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ordered per-connection mailbox.
 *
 * Enqueue never blocks: events are appended in the caller's order and a
 * single drain task delivers them on the fan-out executor. At most one drain
 * runs per queue, which keeps delivery order equal to enqueue order.
 */
@Slf4j
public class OutboundQueue {

    private final ClientChannel channel;
    private final Executor executor;
    private final int maxPending;

    private final Queue<ServerEvent> pending = new ConcurrentLinkedQueue<>();
    private final AtomicInteger size = new AtomicInteger();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public OutboundQueue(ClientChannel channel, Executor executor, int maxPending) {
        this.channel = channel;
        this.executor = executor;
        this.maxPending = maxPending;
    }

    /**
     * @return false when the event was not accepted (queue closed or overflowed)
     */
    public boolean enqueue(ServerEvent event) {
        if (closed.get()) return false;

        if (size.incrementAndGet() > maxPending) {
            size.decrementAndGet();
            log.warn("Outbound queue overflow, closing slow connection [connection={}, pending={}]",
                    channel.id(), maxPending);
            close("outbound backlog exceeded");
            return false;
        }

        pending.add(event);
        scheduleDrain();
        return true;
    }

    public int pendingCount() {
        return size.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public void close(String reason) {
        if (closed.compareAndSet(false, true)) {
            pending.clear();
            size.set(0);
            channel.close(reason);
        }
    }

    private void scheduleDrain() {
        if (draining.compareAndSet(false, true)) {
            executor.execute(this::drain);
        }
    }

    private void drain() {
        try {
            ServerEvent next;
            while (!closed.get() && (next = pending.poll()) != null) {
                size.decrementAndGet();
                if (!channel.isOpen()) {
                    close("channel closed");
                    return;
                }
                try {
                    channel.deliver(next);
                } catch (IOException e) {
                    log.warn("Delivery failed, closing connection [connection={}, event={}]: {}",
                            channel.id(), next.event(), e.getMessage());
                    close("delivery failure");
                    return;
                }
            }
        } finally {
            draining.set(false);
        }
        // An enqueue may have slipped in between the last poll and the flag reset
        if (!closed.get() && !pending.isEmpty()) {
            scheduleDrain();
        }
    }
}
