package com.deepansh.collab.support;

import com.deepansh.collab.broadcast.ClientChannel;
import com.deepansh.collab.broadcast.ServerEvent;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** In-memory channel that keeps every delivered event. */
public class RecordingChannel implements ClientChannel {

    private static final AtomicInteger SEQ = new AtomicInteger();

    private final String id = "conn-" + SEQ.incrementAndGet();
    private final List<ServerEvent> events = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile String closeReason;
    private volatile boolean failDelivery;

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void deliver(ServerEvent event) throws IOException {
        if (failDelivery) throw new IOException("broken pipe");
        events.add(event);
    }

    @Override
    public void close(String reason) {
        open = false;
        closeReason = reason;
    }

    public void failDeliveries() {
        this.failDelivery = true;
    }

    public List<ServerEvent> events() {
        return List.copyOf(events);
    }

    public List<String> eventNames() {
        return events.stream().map(ServerEvent::event).toList();
    }

    public List<ServerEvent> named(String event) {
        return events.stream().filter(e -> e.event().equals(event)).toList();
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> lastPayload(String event) {
        List<ServerEvent> matching = named(event);
        if (matching.isEmpty()) throw new AssertionError("No " + event + " event delivered; got " + eventNames());
        return (Map<String, Object>) matching.get(matching.size() - 1).payload();
    }

    public void clear() {
        events.clear();
    }

    public String closeReason() {
        return closeReason;
    }
}
