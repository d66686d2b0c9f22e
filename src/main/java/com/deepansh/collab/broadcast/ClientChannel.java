package com.deepansh.collab.broadcast;

import java.io.IOException;

/**
 * Transport-side endpoint of one client connection. Implementations are
 * called from a single drain thread at a time.
 */
public interface ClientChannel {

    String id();

    boolean isOpen();

    void deliver(ServerEvent event) throws IOException;

    /** Close the underlying transport; must not throw. */
    void close(String reason);
}
