package com.deepansh.collab.voice;

/**
 * Abstraction over the external real-time media service.
 * The engine only signals voice state; audio itself flows through that service.
 */
public interface MediaServiceClient {

    /**
     * Request a grant for one user on one channel.
     *
     * @throws RuntimeException when the service is unreachable or refuses
     */
    MediaGrant requestGrant(String channelName, String userId);
}
