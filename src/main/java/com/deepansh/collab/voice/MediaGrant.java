package com.deepansh.collab.voice;

import java.time.Instant;

/**
 * Credentials a client needs to join the external media channel.
 */
public record MediaGrant(String channelName, String token, long uid, Instant expiresAt) {
}
