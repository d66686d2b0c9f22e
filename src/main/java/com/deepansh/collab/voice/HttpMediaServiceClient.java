package com.deepansh.collab.voice;

import com.deepansh.collab.config.CollabProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Component("httpMediaServiceClient")
@Slf4j
public class HttpMediaServiceClient implements MediaServiceClient {

    private static final long GRANT_TTL_SECONDS = 24 * 3600;

    private final RestClient restClient;

    public HttpMediaServiceClient(RestClient.Builder restClientBuilder, CollabProperties properties) {
        CollabProperties.Media media = properties.getMedia();
        this.restClient = restClientBuilder
                .baseUrl(media.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + media.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public MediaGrant requestGrant(String channelName, String userId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("channelName", channelName);
        body.put("userId", userId);
        body.put("ttlSeconds", GRANT_TTL_SECONDS);

        log.debug("Requesting media grant [channel={}, userId={}]", channelName, userId);

        Map<String, Object> response = restClient.post()
                .uri("/grants")
                .body(body)
                .retrieve()
                .body(new ParameterizedTypeReference<>() {});

        return parseGrant(channelName, response);
    }

    private MediaGrant parseGrant(String channelName, Map<String, Object> response) {
        if (response == null || !(response.get("token") instanceof String token) || token.isBlank()) {
            throw new IllegalStateException("Media service returned no token for channel " + channelName);
        }
        long uid = response.get("uid") instanceof Number n ? n.longValue() : 0L;
        Instant expiresAt = response.get("expiresAt") instanceof Number n
                ? Instant.ofEpochSecond(n.longValue())
                : null;
        return new MediaGrant(channelName, token, uid, expiresAt);
    }
}
