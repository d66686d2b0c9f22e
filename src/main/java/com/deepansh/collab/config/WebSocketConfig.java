package com.deepansh.collab.config;

import com.deepansh.collab.ws.CollabWebSocketHandler;
import com.deepansh.collab.ws.HandshakeIdentityInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String ENDPOINT = "/ws/collab";

    private final CollabWebSocketHandler collabWebSocketHandler;
    private final HandshakeIdentityInterceptor handshakeIdentityInterceptor;

    @Value("${collab.ws.allowed-origins:*}")
    private String[] allowedOrigins;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(collabWebSocketHandler, ENDPOINT)
                .addInterceptors(handshakeIdentityInterceptor)
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
