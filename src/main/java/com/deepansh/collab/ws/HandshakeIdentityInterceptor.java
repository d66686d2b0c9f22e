package com.deepansh.collab.ws;

import com.deepansh.collab.model.UserIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Takes the caller's identity, as asserted by the upstream auth provider,
 * from handshake headers or query parameters. Connections without a user id
 * are refused.
 */
@Component
@Slf4j
public class HandshakeIdentityInterceptor implements HandshakeInterceptor {

    public static final String IDENTITY_ATTRIBUTE = "collab.identity";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        MultiValueMap<String, String> query = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams();

        String userId = read(request, query, "X-User-Id", "userId");
        if (userId == null) {
            log.warn("Handshake refused, no user id [remote={}]", request.getRemoteAddress());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        UserIdentity identity = new UserIdentity(userId,
                read(request, query, "X-Display-Name", "displayName"),
                read(request, query, "X-Zodiac-Sign", "zodiacSign"));
        attributes.put(IDENTITY_ATTRIBUTE, identity);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
    }

    private static String read(ServerHttpRequest request, MultiValueMap<String, String> query,
                               String header, String param) {
        String value = request.getHeaders().getFirst(header);
        if (value == null || value.isBlank()) {
            String raw = query.getFirst(param);
            value = raw == null ? null : UriUtils.decode(raw, StandardCharsets.UTF_8);
        }
        return value == null || value.isBlank() ? null : value.trim();
    }
}
