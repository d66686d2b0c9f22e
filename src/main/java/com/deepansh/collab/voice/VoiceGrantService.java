package com.deepansh.collab.voice;

import com.deepansh.collab.broadcast.BroadcastFanout;
import com.deepansh.collab.broadcast.ServerEvent;
import com.deepansh.collab.config.CollabProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fetches media credentials off the session monitor and hands them to the
 * joining user only. A failure is reported to that user; voice signaling
 * state is left as it is.
 */
@Service
@Slf4j
public class VoiceGrantService {

    private final MediaServiceClient mediaServiceClient;
    private final BroadcastFanout fanout;
    private final CollabProperties properties;

    public VoiceGrantService(MediaServiceClient mediaServiceClient,
                             BroadcastFanout fanout,
                             CollabProperties properties) {
        this.mediaServiceClient = mediaServiceClient;
        this.fanout = fanout;
        this.properties = properties;
    }

    @Async("voiceTaskExecutor")
    public void issueCredentials(String sessionId, String userId) {
        if (!properties.getMedia().isEnabled()) return;

        String channelName = channelName(sessionId);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", sessionId);
        payload.put("channelName", channelName);
        try {
            MediaGrant grant = mediaServiceClient.requestGrant(channelName, userId);
            payload.put("available", true);
            payload.put("token", grant.token());
            payload.put("uid", grant.uid());
            payload.put("expiresAt", grant.expiresAt());
            log.info("Media grant issued [sessionId={}, userId={}]", sessionId, userId);
        } catch (RuntimeException e) {
            log.warn("Media grant unavailable [sessionId={}, userId={}]: {}", sessionId, userId, e.getMessage());
            payload.put("available", false);
            payload.put("reason", "Voice service is unavailable right now");
        }
        fanout.sendToUser(userId, ServerEvent.of(ServerEvent.VOICE_CREDENTIALS, payload));
    }

    static String channelName(String sessionId) {
        return "collab_" + sessionId;
    }
}
