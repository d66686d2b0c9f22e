package com.deepansh.collab.chat;

import com.deepansh.collab.config.CollabProperties;
import com.deepansh.collab.session.SessionLifecycleListener;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Per-user flood control for chat, one resilience4j limiter per
 * (session, user). Denials never wait: the caller gets RateLimited at once.
 */
@Component
@Slf4j
public class ChatRateLimiter implements SessionLifecycleListener {

    private static final String NAME_SEPARATOR = "::";

    private final RateLimiterRegistry registry;

    public ChatRateLimiter(CollabProperties properties) {
        CollabProperties.Chat.RateLimit limit = properties.getChat().getRateLimit();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(limit.getLimitForPeriod())
                .limitRefreshPeriod(limit.getRefreshPeriod())
                .timeoutDuration(Duration.ZERO)
                .build();
        this.registry = RateLimiterRegistry.of(config);
    }

    public boolean tryAcquire(String sessionId, String userId) {
        RateLimiter limiter = registry.rateLimiter(sessionId + NAME_SEPARATOR + userId);
        boolean permitted = limiter.acquirePermission();
        if (!permitted) {
            log.warn("Chat rate limit hit [sessionId={}, userId={}]", sessionId, userId);
        }
        return permitted;
    }

    @Override
    public void onSessionPurged(String sessionId) {
        String prefix = sessionId + NAME_SEPARATOR;
        registry.getAllRateLimiters().stream()
                .map(RateLimiter::getName)
                .filter(name -> name.startsWith(prefix))
                .toList()
                .forEach(registry::remove);
    }
}
